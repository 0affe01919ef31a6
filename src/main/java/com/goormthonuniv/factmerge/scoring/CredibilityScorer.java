package com.goormthonuniv.factmerge.scoring;

import com.goormthonuniv.factmerge.dto.CredibilityScore;
import com.goormthonuniv.factmerge.dto.Document;
import com.goormthonuniv.factmerge.dto.DocumentType;

/**
 * 문서 유형별 다중 신호 신뢰도 채점기.
 * 외부 호출 실패는 신호별 기본값으로 대체되며 예외로 나가지 않는다.
 * 채점 중 얻은 값(권위 점수, 서지 정보 등)은 문서 metadata 에 기록할 수 있다.
 */
public interface CredibilityScorer {

    DocumentType documentType();

    CredibilityScore score(Document doc);
}
