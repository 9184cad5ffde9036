package io.quarkiverse.dapr.agentex.agent.workflow;

import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import io.dapr.workflows.Workflow;
import io.dapr.workflows.WorkflowStub;
import io.dapr.workflows.WorkflowTaskOptions;
import io.quarkiverse.dapr.agentex.agent.ConversationMessage;
import io.quarkiverse.dapr.agentex.agent.FinalResult;
import io.quarkiverse.dapr.agentex.agent.activities.InvokeAgentInput;
import io.quarkiverse.dapr.agentex.agent.activities.StreamingInvokeActivity;
import io.quarkiverse.dapr.agentex.context.ExecutionContext;
import io.quarkiverse.dapr.agentex.interceptor.ContextPropagatingActivityCaller;

/**
 * Dapr Workflow representing one agent task: a conversation of user messages and agent turns.
 * <p>
 * <h3>Lifecycle</h3>
 * <ol>
 *   <li>Started by {@link AgentTaskLauncher#start} with the task id as the instance id. The task
 *       id, trace id and parent span id are kept as workflow state in an {@link ExecutionContext}.</li>
 *   <li>Loops waiting for {@code "task-event"} external events.</li>
 *   <li>For each {@code "message"} event, schedules a {@link StreamingInvokeActivity} through the
 *       {@link ContextPropagatingActivityCaller}, which stamps the workflow's identifiers into the
 *       activity headers. History and the resume token of the previous turn are passed along.</li>
 *   <li>After each turn, updates the Dapr custom status with an {@link AgentTaskStatus}.</li>
 *   <li>Terminates when a {@code "done"} event is received.</li>
 * </ol>
 * Workflow code is replayed by the engine, so it only builds values and awaits engine tasks;
 * all I/O happens in the activity.
 */
public class AgentTaskWorkflow implements Workflow {

    private static final Logger LOG = Logger.getLogger(AgentTaskWorkflow.class);

    public static final String EVENT_NAME = "task-event";

    private final ContextPropagatingActivityCaller activityCaller;

    public AgentTaskWorkflow() {
        this(new ContextPropagatingActivityCaller());
    }

    AgentTaskWorkflow(ContextPropagatingActivityCaller activityCaller) {
        this.activityCaller = activityCaller;
    }

    @Override
    public WorkflowStub create() {
        return ctx -> {
            AgentTaskInput input = ctx.getInput(AgentTaskInput.class);
            String taskId = input.taskId();
            String agentName = input.agentName();
            ExecutionContext taskState = new ExecutionContext(taskId, input.traceId(), input.parentSpanId());
            WorkflowTaskOptions invokeOptions = input.retryPolicyOrDefault().toTaskOptions();

            if (!ctx.isReplaying()) {
                LOG.infof("[Task:%s] AgentTaskWorkflow started — agent=%s, traceId=%s",
                        taskId, agentName, input.traceId());
            }

            List<ConversationMessage> history = new ArrayList<>();
            String resumeToken = null;
            String lastMessageId = null;
            String lastOutput = null;
            int turns = 0;
            ctx.setCustomStatus(new AgentTaskStatus(agentName, AgentTaskStatus.Phase.WAITING, turns, null, null));

            while (true) {
                TaskEvent event = ctx.waitForExternalEvent(EVENT_NAME, TaskEvent.class).await();

                if (TaskEvent.DONE.equals(event.type())) {
                    if (!ctx.isReplaying()) {
                        LOG.infof("[Task:%s] AgentTaskWorkflow completed — agent=%s, turns=%d",
                                taskId, agentName, turns);
                    }
                    break;
                }

                if (!TaskEvent.MESSAGE.equals(event.type())) {
                    if (!ctx.isReplaying()) {
                        LOG.warnf("[Task:%s] Ignoring unknown event type: %s", taskId, event.type());
                    }
                    continue;
                }

                ctx.setCustomStatus(new AgentTaskStatus(agentName, AgentTaskStatus.Phase.RUNNING, turns,
                        lastMessageId, lastOutput));
                String invocationId = taskId + ":" + (turns + 1);
                List<ConversationMessage> priorMessages = List.copyOf(history);
                String previousToken = resumeToken;
                if (!ctx.isReplaying()) {
                    LOG.infof("[Task:%s] Scheduling StreamingInvokeActivity — invocation=%s", taskId, invocationId);
                }
                FinalResult result = activityCaller.call(ctx, StreamingInvokeActivity.class.getName(), taskState,
                        headers -> new InvokeAgentInput(headers, invocationId, event.content(), priorMessages,
                                previousToken, List.of()),
                        invokeOptions, FinalResult.class);

                turns++;
                history.add(ConversationMessage.user(event.content()));
                history.add(ConversationMessage.agent(result.output()));
                resumeToken = result.resumeToken();
                lastMessageId = result.messageId();
                lastOutput = result.output();
                if (!ctx.isReplaying()) {
                    LOG.infof("[Task:%s] StreamingInvokeActivity completed — invocation=%s, message=%s",
                            taskId, invocationId, lastMessageId);
                }
                ctx.setCustomStatus(new AgentTaskStatus(agentName, AgentTaskStatus.Phase.WAITING, turns,
                        lastMessageId, lastOutput));
            }

            AgentTaskStatus finalStatus = new AgentTaskStatus(agentName, AgentTaskStatus.Phase.COMPLETED, turns,
                    lastMessageId, lastOutput);
            ctx.setCustomStatus(finalStatus);
            ctx.complete(finalStatus);
        };
    }
}
