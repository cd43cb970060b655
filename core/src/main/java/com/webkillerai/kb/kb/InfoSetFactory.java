package com.webkillerai.kb.kb;

import com.webkillerai.kb.model.Info;
import com.webkillerai.kb.model.InfoSet;

import java.util.List;

/** 매칭되는 그룹이 없을 때 seed 로 새 InfoSet 을 만든다 (예: InfoSet::new, ParamInfoSet::new) */
@FunctionalInterface
public interface InfoSetFactory {
    InfoSet create(List<Info> seed);

    InfoSetFactory DEFAULT = InfoSet::new;
}
