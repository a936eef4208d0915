package alpha.grouprouter;

import alpha.grouprouter.hook.Hooks;

import java.util.Optional;

/**
 * A router scoped to a path prefix.<p>
 * 
 * A group is created using {@link Router#group(String,
 * alpha.grouprouter.handler.Handler...)}, and its prefix is the creating
 * router's prefix composed with the given path. Groups form a tree rooted in
 * the application's {@linkplain App#root() root group}. The application owns
 * all groups for its entire lifetime; a group only references its parent.<p>
 * 
 * <h2>Naming</h2>
 * 
 * What {@link #name(String)} names depends on the group's history. If no
 * route, middleware, static file server or mounted application has yet been
 * registered through one of the group's own methods, then the group names
 * itself. The group's name is the parent group's name concatenated with the
 * given name, no delimiter added:
 * 
 * {@snippet :
 *   Group user = app.group("/user").name("user.");
 *   Group list = user.group("/list").name("list"); // "user.list"
 * }
 * 
 * After the first registration, {@code name()} instead names the most
 * recently registered route of the application, just as
 * {@link App#name(String)} does. The route's name is qualified with the name
 * of the group that registered it:
 * 
 * {@snippet :
 *   user.get("/:id", getUser).name("get"); // route named "user.get"
 * }
 * 
 * Naming the group itself holds the application-wide naming lock for the
 * duration of the operation, including the invocation of the
 * {@linkplain Hooks#onGroupName(alpha.grouprouter.hook.GroupHook) group-named
 * hooks}.<p>
 * 
 * Registrations made through a group created by this group, or through a
 * {@link alpha.grouprouter.route.RouteBuilder}, do not affect this group's
 * naming mode. Nor does the middleware registered by
 * {@link #group(String, alpha.grouprouter.handler.Handler...)}.
 */
public interface Group extends Router
{
    /**
     * {@return the normalized absolute prefix of this group}
     */
    String prefix();
    
    /**
     * {@return the fully-qualified name of this group}
     */
    Optional<String> name();
    
    /**
     * {@return the group that created this group}<p>
     * 
     * Only the root group has no parent.
     */
    Optional<Group> parent();
    
    /**
     * {@return the application that owns this group}
     */
    App app();
    
    /**
     * {@return {@code true} if anything has been registered through this
     * group, otherwise {@code false}}<p>
     * 
     * Once {@code true}, the value never changes.
     */
    boolean anyRouteDefined();
    
    /**
     * {@return a snapshot of the group's current state}
     */
    Snapshot snapshot();
    
    /**
     * An immutable copy of a group's state, given to group hooks.
     * 
     * @param prefix of group
     * @param name of group ({@code null} if not named)
     * @param parentName of the parent ({@code null} if no parent, or parent
     *                   is not named)
     */
    record Snapshot(String prefix, String name, String parentName) {
        // Empty
    }
}
