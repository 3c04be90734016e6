package br.edu.ifba.hybridrag.query.pipeline;

import br.edu.ifba.hybridrag.query.AnswerSynthesizer;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Generates the cited answer from the fused context.
 */
public class SynthesisStage implements PipelineStage {

    private static final String STAGE_NAME = "synthesis";

    private final AnswerSynthesizer answerSynthesizer;

    public SynthesisStage(@NotNull AnswerSynthesizer answerSynthesizer) {
        this.answerSynthesizer = answerSynthesizer;
    }

    @Override
    public CompletableFuture<PipelineContext> process(@NotNull PipelineContext context) {
        return context.track(answerSynthesizer.synthesize(context.getQuery(), context.getOrderedContext()))
            .thenApply(answer -> {
                context.setAnswer(answer);
                return context;
            });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }
}
