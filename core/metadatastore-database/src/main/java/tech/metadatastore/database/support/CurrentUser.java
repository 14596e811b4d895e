package tech.metadatastore.database.support;

/**
 * Resolves the identity of the user running this process.
 * Looked up on every call so each record reflects whoever created it.
 */
public final class CurrentUser {

    private static final String FALLBACK = "unknown";

    private CurrentUser() {}

    /**
     * @return the operating system user name, or "unknown" when it cannot be determined
     */
    public static String name() {
        String name = System.getProperty("user.name");
        if (name == null || name.isBlank()) {
            name = System.getenv("USER");
        }
        return (name == null || name.isBlank()) ? FALLBACK : name;
    }
}
