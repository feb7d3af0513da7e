package io.mockdispatch.core.query;

/**
 * Naive English singularization used to derive relation field names
 * ({@code users} → {@code userId}). Only strips one trailing {@code s}: {@code categories}
 * becomes {@code categorie}.
 */
public final class Inflector {

    private Inflector() {}

    public static String singularize(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return name.endsWith("s") ? name.substring(0, name.length() - 1) : name;
    }

    /** Name of the foreign-key field that points at records of {@code resourceName}. */
    public static String foreignKey(String resourceName) {
        return singularize(resourceName) + "Id";
    }
}
