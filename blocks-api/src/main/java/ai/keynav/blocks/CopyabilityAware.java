package ai.keynav.blocks;

/**
 * A copyable node that decides for itself whether it can be copied. Nodes without this capability are copyable
 * only when they are both own-deletable and own-movable.
 */
public interface CopyabilityAware extends Copyable {
    boolean isCopyable();
}
