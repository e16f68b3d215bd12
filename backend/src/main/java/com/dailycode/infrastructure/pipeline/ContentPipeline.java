package com.dailycode.infrastructure.pipeline;

import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.delivery.exception.GenerationException;
import com.dailycode.domain.delivery.model.Commentary;
import com.dailycode.domain.delivery.model.DegradationWarning;
import com.dailycode.domain.delivery.model.OutboundMessage;
import com.dailycode.domain.delivery.model.PipelineOutcome;
import com.dailycode.domain.delivery.model.PipelineStage;
import com.dailycode.domain.delivery.model.ProblemPayload;
import com.dailycode.domain.delivery.model.Solution;
import com.dailycode.domain.delivery.model.StageFailure;
import com.dailycode.domain.delivery.service.CommentaryGenerator;
import com.dailycode.domain.delivery.service.MessageSender;
import com.dailycode.domain.delivery.service.SolutionGenerator;
import com.dailycode.domain.problem.model.Problem;
import com.dailycode.domain.subscriber.model.Subscriber;
import com.dailycode.infrastructure.email.MessageComposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Drives one subscriber's problem through the stages:
 * <p>
 * fetch → solve → embellish → send
 * </p>
 * Each stage calls exactly one collaborator and either hands its payload to the next stage or
 * stops the pipeline with a {@link StageFailure}. Nothing is retried. State lives on the stack,
 * so one instance serves all workers concurrently.
 */
@Slf4j
@Component
public class ContentPipeline {

    private final ProblemPayloadMapper payloadMapper;
    private final SolutionGenerator solutionGenerator;
    private final CommentaryGenerator commentaryGenerator;
    private final MessageComposer messageComposer;
    private final MessageSender messageSender;
    private final EmbellishmentFailurePolicy embellishmentPolicy;

    public ContentPipeline(ProblemPayloadMapper payloadMapper,
                           SolutionGenerator solutionGenerator,
                           CommentaryGenerator commentaryGenerator,
                           MessageComposer messageComposer,
                           MessageSender messageSender,
                           DailyCodeProperties properties) {
        this.payloadMapper = payloadMapper;
        this.solutionGenerator = solutionGenerator;
        this.commentaryGenerator = commentaryGenerator;
        this.messageComposer = messageComposer;
        this.messageSender = messageSender;
        this.embellishmentPolicy = properties.delivery().embellishmentFailurePolicy();
    }

    public PipelineOutcome execute(Problem problem, Subscriber subscriber) {
        StageResult<ProblemPayload> fetched = runStage(PipelineStage.FETCH, () -> payloadMapper.toPayload(problem));
        if (fetched.isFailure()) {
            return PipelineOutcome.failed(fetched.failure());
        }
        ProblemPayload payload = fetched.value();

        StageResult<Solution> solved = runStage(PipelineStage.SOLVE, () -> solve(payload, subscriber));
        if (solved.isFailure()) {
            return PipelineOutcome.failed(solved.failure());
        }
        Solution solution = solved.value();

        Commentary commentary = null;
        DegradationWarning degradation = null;
        StageResult<Commentary> embellished = runStage(PipelineStage.EMBELLISH,
                () -> commentaryGenerator.embellish(payload, solution));
        if (embellished.isFailure()) {
            StageFailure failure = embellished.failure();
            if (failure.isInterruption() || embellishmentPolicy == EmbellishmentFailurePolicy.FAIL) {
                return PipelineOutcome.failed(failure);
            }
            degradation = new DegradationWarning(failure.errorType(), failure.message());
            log.warn("Embellish failed, sending without commentary - subscriber: {}, problem: {}, error: {}",
                    subscriber.getId(), problem.getId(), failure.describe());
        } else {
            commentary = embellished.value();
        }

        Commentary finalCommentary = commentary;
        StageResult<OutboundMessage> sent = runStage(PipelineStage.SEND, () -> {
            OutboundMessage message = messageComposer.composeDaily(subscriber, payload, solution, finalCommentary);
            messageSender.send(message);
            return message;
        });
        if (sent.isFailure()) {
            return PipelineOutcome.failed(sent.failure());
        }

        log.debug("Pipeline completed - subscriber: {}, problem: {}, degraded: {}",
                subscriber.getId(), problem.getId(), degradation != null);
        return PipelineOutcome.sent(degradation);
    }

    private Solution solve(ProblemPayload payload, Subscriber subscriber) {
        Solution solution = solutionGenerator.generate(payload, subscriber.getLanguage());
        if (solution == null || !solution.hasCode()) {
            throw new GenerationException("Empty solution for " + payload.id() + " in " + subscriber.getLanguage().code());
        }
        return solution;
    }

    private <T> StageResult<T> runStage(PipelineStage stage, Supplier<T> action) {
        if (Thread.currentThread().isInterrupted()) {
            return StageResult.failure(StageFailure.interrupted(stage));
        }
        try {
            return StageResult.success(action.get());
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                return StageResult.failure(StageFailure.interrupted(stage));
            }
            log.debug("Stage {} failed", stage.label(), e);
            return StageResult.failure(StageFailure.of(stage, e));
        }
    }
}
