package com.webkillerai.kb.kb;

import com.webkillerai.kb.model.InfoSet;

/** appendUniqGroup 결과: KB 에 저장된 InfoSet 과 신규 생성 여부 */
public record GroupResult(InfoSet infoSet, boolean created) {}
