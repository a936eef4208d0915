package alpha.grouprouter.core;

import alpha.grouprouter.App;
import alpha.grouprouter.Group;
import alpha.grouprouter.hook.GroupHook;
import alpha.grouprouter.hook.HookFailedException;
import alpha.grouprouter.hook.Hooks;
import alpha.grouprouter.hook.MountHook;
import alpha.grouprouter.hook.RouteHook;
import alpha.grouprouter.route.Registration;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Hooks}.<p>
 * 
 * Also the dispatcher; the execute-methods are called by the core at each
 * extension point.
 */
final class DefaultHooks implements Hooks
{
    private static final System.Logger LOG
            = System.getLogger(DefaultHooks.class.getPackageName());
    
    private final List<RouteHook> onRoute, onName;
    private final List<GroupHook> onGroup, onGroupName;
    private final List<MountHook> onMount;
    
    DefaultHooks() {
        onRoute     = new CopyOnWriteArrayList<>();
        onName      = new CopyOnWriteArrayList<>();
        onGroup     = new CopyOnWriteArrayList<>();
        onGroupName = new CopyOnWriteArrayList<>();
        onMount     = new CopyOnWriteArrayList<>();
    }
    
    @Override
    public Hooks onRoute(RouteHook hook) {
        onRoute.add(requireNonNull(hook));
        return this;
    }
    
    @Override
    public Hooks onName(RouteHook hook) {
        onName.add(requireNonNull(hook));
        return this;
    }
    
    @Override
    public Hooks onGroup(GroupHook hook) {
        onGroup.add(requireNonNull(hook));
        return this;
    }
    
    @Override
    public Hooks onGroupName(GroupHook hook) {
        onGroupName.add(requireNonNull(hook));
        return this;
    }
    
    @Override
    public Hooks onMount(MountHook hook) {
        onMount.add(requireNonNull(hook));
        return this;
    }
    
    void executeOnRoute(Registration r) {
        for (RouteHook h : onRoute) {
            run("onRoute", r, () -> h.accept(r));
        }
    }
    
    void executeOnName(Registration r) {
        for (RouteHook h : onName) {
            run("onName", r, () -> h.accept(r));
        }
    }
    
    void executeOnGroup(Group.Snapshot g) {
        for (GroupHook h : onGroup) {
            run("onGroup", g, () -> h.accept(g));
        }
    }
    
    void executeOnGroupName(Group.Snapshot g) {
        for (GroupHook h : onGroupName) {
            run("onGroupName", g, () -> h.accept(g));
        }
    }
    
    void executeOnMount(App parent, String prefix) {
        for (MountHook h : onMount) {
            run("onMount", prefix, () -> h.accept(parent, prefix));
        }
    }
    
    @FunctionalInterface
    private interface Invocation {
        void run() throws Exception;
    }
    
    private static void run(String point, Object subject, Invocation hook) {
        try {
            hook.run();
        } catch (Exception e) {
            LOG.log(DEBUG, () -> "Hook " + point + " rejected: " + subject);
            throw new HookFailedException(
                    "Hook " + point + " failed for: " + subject, e);
        }
    }
}
