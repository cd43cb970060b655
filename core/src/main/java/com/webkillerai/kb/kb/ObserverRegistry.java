package com.webkillerai.kb.kb;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 정수 핸들 → 옵저버 레지스트리.
 * 약한 참조를 쓰지 않으므로 더 이상 필요 없는 옵저버는 remove(handle) 로 직접 해제해야 한다.
 * 통지는 등록 순서대로, 호출 시점 스냅샷 위에서 수행한다.
 */
public final class ObserverRegistry {

    private final AtomicInteger lastHandle = new AtomicInteger(0);
    private final ConcurrentSkipListMap<Integer, KbObserver> observers = new ConcurrentSkipListMap<>();

    /** @return 새 핸들(1부터 단조 증가) */
    public int add(KbObserver observer) {
        Objects.requireNonNull(observer, "observer");
        int handle = lastHandle.incrementAndGet();
        observers.put(handle, observer);
        return handle;
    }

    public boolean remove(int handle) {
        return observers.remove(handle) != null;
    }

    public void clear() { observers.clear(); }

    public int size() { return observers.size(); }

    /** 옵저버 예외는 그대로 호출자에게 전파된다 */
    public void fire(Consumer<KbObserver> call) {
        List<KbObserver> snapshot = List.copyOf(observers.values());
        for (KbObserver o : snapshot) {
            call.accept(o);
        }
    }
}
