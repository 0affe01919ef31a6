package com.goormthonuniv.factmerge.lookup;

import java.util.Optional;

public interface PopularityIndexAdapter {
    String name(); // "openpagerank"

    /**
     * 도메인 인기도(0~10 원점수)를 0.0~1.0 으로 정규화해 돌려준다.
     * 전송 오류, 비정상 상태코드, 필드 누락은 모두 empty.
     */
    Optional<Double> authority(String domain);
}
