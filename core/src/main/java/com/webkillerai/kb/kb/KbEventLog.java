package com.webkillerai.kb.kb;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.webkillerai.kb.model.InfoSet;
import com.webkillerai.kb.model.LockPolicy;
import com.webkillerai.kb.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * KB 생명주기/그룹 이벤트를 JSON 한 줄로 남긴다.
 * 출력은 일반 slf4j 로거로 나가므로 바인딩 설정을 그대로 따른다.
 */
final class KbEventLog {

    private static final ObjectMapper OM = JsonMappers.standard();

    private final Logger log;
    private final String comp;

    KbEventLog(Logger log, String comp) {
        this.log = log;
        this.comp = comp;
    }

    static KbEventLog get(Class<?> cls) {
        return new KbEventLog(LoggerFactory.getLogger(cls), cls.getSimpleName());
    }

    void setup(String table, LockPolicy policy) {
        if (log.isInfoEnabled()) log.info(render("kb-setup", "table", table, "lockPolicy", policy.name()));
    }

    void cleanup(String table, int deleted) {
        if (log.isInfoEnabled()) log.info(render("kb-cleanup", "table", table, "deleted", deleted));
    }

    void remove(String table) {
        if (log.isInfoEnabled()) log.info(render("kb-remove", "table", table));
    }

    void updateStale(String table, String oldId, String newId) {
        if (log.isWarnEnabled()) log.warn(render("kb-update-stale", "table", table, "oldId", oldId, "newId", newId));
    }

    void groupCreated(String locationA, String locationB, InfoSet group) {
        if (log.isDebugEnabled()) {
            log.debug(render("kb-group-created", "a", locationA, "b", locationB, "group", group.getName()));
        }
    }

    void groupMerged(String locationA, String locationB, InfoSet group) {
        if (log.isDebugEnabled()) {
            log.debug(render("kb-group-merged", "a", locationA, "b", locationB,
                    "group", group.getName(), "size", group.size()));
        }
    }

    /** kvs 는 key, value 쌍. 값은 Jackson 이 타입대로 적는다 */
    String render(String event, Object... kvs) {
        ObjectNode node = OM.createObjectNode();
        node.put("ts", Instant.now().toString());
        node.put("comp", comp);
        node.put("thread", Thread.currentThread().getName());
        node.put("event", event);
        for (int i = 0; i + 1 < kvs.length; i += 2) {
            node.set(String.valueOf(kvs[i]), OM.valueToTree(kvs[i + 1]));
        }
        return node.toString();
    }
}
