package com.hostpanel.orchestrator;

/**
 * Sets generated ids on entities built in tests; JPA normally does this on persist.
 */
public final class TestEntities {

    private TestEntities() {}

    public static <T> T withId(T entity, Long id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return entity;
    }
}
