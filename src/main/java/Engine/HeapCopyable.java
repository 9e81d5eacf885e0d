package Engine;

/**
 * Heap values that carry mutable state implement this so that checkpoints
 * keep an independent copy. Other values are shared between snapshots.
 */
public interface HeapCopyable<T> {
    T deepCopy();
}
