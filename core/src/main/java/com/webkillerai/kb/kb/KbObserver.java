package com.webkillerai.kb.kb;

import com.webkillerai.kb.model.Finding;

import java.net.URI;

/**
 * KB 이벤트 리스너. 호출자 스레드에서 동기 호출되며 주소로 걸러지지 않는다.
 * 필요한 이벤트만 재정의하면 된다.
 */
public interface KbObserver {

    /** raw=true 면 rawWrite 로 들어온 비-Finding 값 */
    default void onAppend(String locationA, String locationB, Object value, boolean raw) {}

    default void onUpdate(Finding oldValue, Finding newValue) {}

    default void onAddUrl(URI url) {}
}
