package alpha.grouprouter.hook;

import alpha.grouprouter.App;

/**
 * Called when an application is mounted into a parent application.
 * 
 * @see Hooks#onMount(MountHook)
 */
@FunctionalInterface
public interface MountHook
{
    /**
     * Observes the mount.
     * 
     * @param parent the application mounted into
     * @param prefix the absolute mount path
     * 
     * @throws Exception
     *             to reject the mount, which aborts the operation
     */
    void accept(App parent, String prefix) throws Exception;
}
