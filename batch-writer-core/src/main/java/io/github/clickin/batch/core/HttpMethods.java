package io.github.clickin.batch.core;

import java.util.Locale;
import java.util.Set;

/**
 * HTTP methods accepted for batch operations.
 */
public final class HttpMethods {
    private HttpMethods() {}

    public static final String GET = "GET";
    public static final String POST = "POST";
    public static final String PUT = "PUT";
    public static final String PATCH = "PATCH";
    public static final String MERGE = "MERGE";
    public static final String DELETE = "DELETE";

    private static final Set<String> SUPPORTED = Set.of(GET, POST, PUT, PATCH, MERGE, DELETE);

    /**
     * Whether the method may be used for a batch operation.
     *
     * @param method the HTTP method, case-insensitive
     * @return {@code true} if supported
     */
    public static boolean isSupported(String method) {
        return method != null && SUPPORTED.contains(method.toUpperCase(Locale.ROOT));
    }

    /**
     * Whether the method only reads data. Query methods are not allowed inside a changeset.
     *
     * @param method the HTTP method, case-insensitive
     * @return {@code true} for {@code GET}
     */
    public static boolean isQueryMethod(String method) {
        return GET.equalsIgnoreCase(method);
    }
}
