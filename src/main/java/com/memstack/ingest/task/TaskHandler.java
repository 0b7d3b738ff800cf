package com.memstack.ingest.task;

/**
 * A unit of work for one task kind.
 *
 * <p>Handlers are stateless: everything a single invocation needs arrives in the typed
 * payload, and shared resources arrive in the {@link TaskContext}. New kinds are added by
 * implementing this interface and registering the bean; the dispatcher never changes.
 *
 * <p>Example implementation:
 * <pre>
 * public class ReindexTaskHandler implements TaskHandler&lt;ReindexPayload&gt; {
 *     public String getTaskType() { return "reindex"; }
 *     public Class&lt;ReindexPayload&gt; getPayloadType() { return ReindexPayload.class; }
 *     public void process(ReindexPayload payload, TaskContext context) {
 *         // call context.getGraphEngine() ...
 *     }
 * }
 * </pre>
 *
 * @param <P> immutable payload type bound from the submitted key/value map
 */
public interface TaskHandler<P> {

    /**
     * Kind identifier this handler serves (e.g. {@code "add_episode"}).
     */
    String getTaskType();

    /**
     * Type the submitted payload map is bound to before {@link #process} is called.
     */
    Class<P> getPayloadType();

    /**
     * Process one task. Throwing marks the task as failed; the group worker continues.
     *
     * @param payload bound payload
     * @param context shared resources
     */
    void process(P payload, TaskContext context);
}
