package com.knowledgeplatform.knowledge.cache;

/**
 * Cache key namespaces, one per payload purpose.
 */
public final class CacheKeys {

    private CacheKeys() {}

    /** Raw external refresh payload for a sector. */
    public static String externalTopic(String sector) {
        return "api_" + sector;
    }

    /** Raw academic resource summaries for a sector. */
    public static String academicResources(String sector) {
        return "academic_" + sector;
    }
}
