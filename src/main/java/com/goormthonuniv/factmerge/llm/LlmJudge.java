package com.goormthonuniv.factmerge.llm;

import java.util.List;
import java.util.Optional;

/**
 * 생성형 모델 기반 판단. 서비스 비활성/오류/형식 불량은 모두 Optional.empty() (miss).
 */
public interface LlmJudge {

    /**
     * 도메인 이름만 보고 신뢰도를 평가한다.
     * @return 0.0~1.0 점수, 파싱 불가·범위 밖이면 empty
     */
    Optional<Double> rateDomain(String domain);

    /** 저자 소개/문체로 본 전문성 0.0~1.0 */
    Optional<Double> rateAuthorCredentials(String text);

    /** instruction 에 따라 text 에서 사실 주장 문장 목록을 뽑는다 */
    Optional<List<String>> extractClaims(String instruction, String text);
}
