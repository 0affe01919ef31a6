package com.goormthonuniv.factmerge.lookup;

import java.util.Optional;

public interface BibliometricAdapter {
    String name(); // "semantic_scholar"

    /** 제목으로 논문을 찾아 인용수/연도/학회/저자 지표를 돌려준다. 데이터 없음·오류는 empty */
    Optional<PaperMetadata> lookup(String title);
}
