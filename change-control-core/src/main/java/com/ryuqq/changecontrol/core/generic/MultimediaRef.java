package com.ryuqq.changecontrol.core.generic;

import java.net.URI;

/**
 * 증명 대상 콘텐츠의 렌더링 뷰 참조 (예: 스크린샷, PDF).
 *
 * @param mediaType IANA media type (예: {@code application/pdf})
 * @param uri 뷰 위치
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public record MultimediaRef(
    String mediaType,
    URI uri
) {

    public MultimediaRef {
        if (mediaType == null || mediaType.isBlank()) {
            throw new IllegalArgumentException("mediaType cannot be null or blank");
        }
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
    }

    public static MultimediaRef of(String mediaType, URI uri) {
        return new MultimediaRef(mediaType, uri);
    }
}
