package com.goormthonuniv.sitecheck.fetch;

import java.util.Optional;

public interface ScreenshotRenderer {
    /** @return 저장된 스크린샷 경로. 렌더링 불가 시 empty */
    Optional<String> render(String url);
}
