package alpha.grouprouter.hook;

import alpha.grouprouter.Group;

/**
 * Called when a group is created or named.
 * 
 * @see Hooks#onGroup(GroupHook)
 * @see Hooks#onGroupName(GroupHook)
 */
@FunctionalInterface
public interface GroupHook
{
    /**
     * Observes the group.
     * 
     * @param group a snapshot of the group's state
     * 
     * @throws Exception
     *             to reject the group, which aborts the operation
     */
    void accept(Group.Snapshot group) throws Exception;
}
