package br.edu.ifba.hybridrag.query.pipeline;

import br.edu.ifba.hybridrag.core.OrderedContext;
import br.edu.ifba.hybridrag.query.ContextAssembler;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Merges vector and graph results into the citation-indexed context.
 */
public class FusionStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(FusionStage.class);
    private static final String STAGE_NAME = "fusion";

    private final ContextAssembler contextAssembler;

    public FusionStage(@NotNull ContextAssembler contextAssembler) {
        this.contextAssembler = contextAssembler;
    }

    @Override
    public CompletableFuture<PipelineContext> process(@NotNull PipelineContext context) {
        OrderedContext ordered = contextAssembler.assemble(context.getVectorChunks(), context.getGraphContext());
        context.setOrderedContext(ordered);
        logger.debug("Fused context: {} chunks ({} from vector search)", ordered.size(), context.getVectorChunks().size());
        return CompletableFuture.completedFuture(context);
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }
}
