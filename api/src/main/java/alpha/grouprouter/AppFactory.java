package alpha.grouprouter;

/**
 * Factory of {@code App}.<p>
 * 
 * Application code should have no use of this type. It is only public because
 * it is a requirement by Java's service-provider mechanism.
 */
@FunctionalInterface
public interface AppFactory {
    /**
     * Creates a new {@code App}.<p>
     * 
     * This method should only be used by the static method
     * {@link App#create(Config) App.create()}.
     * 
     * @param config of application
     * 
     * @return a new {@code App}
     * 
     * @throws NullPointerException
     *             if {@code config} is {@code null}
     */
    App create(Config config);
}
