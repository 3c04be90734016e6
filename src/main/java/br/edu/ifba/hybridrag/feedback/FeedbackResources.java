package br.edu.ifba.hybridrag.feedback;

import br.edu.ifba.hybridrag.utils.AsyncUtil;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.Optional;

@Path("/api")
public class FeedbackResources {

    @Inject
    FeedbackService feedbackService;

    @POST
    @Path("/feedback")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public FeedbackResponse submitFeedback(@Valid @NotNull final FeedbackRequest request) {
        final Optional<FeedbackRecord> stored = AsyncUtil.await(feedbackService.upsertFeedback(request));
        return stored
            .map(feedback -> FeedbackResponse.success("Feedback saved", feedback))
            .orElseGet(() -> FeedbackResponse.success("Feedback removed", null));
    }

    @GET
    @Path("/feedback/{memoryId}")
    @Produces(MediaType.APPLICATION_JSON)
    public FeedbackResponse getFeedback(@PathParam("memoryId") final long memoryId) {
        return FeedbackResponse.success(null, AsyncUtil.await(feedbackService.getFeedback(memoryId)));
    }

    @DELETE
    @Path("/feedback/{memoryId}")
    @Produces(MediaType.APPLICATION_JSON)
    public FeedbackResponse clearFeedback(@PathParam("memoryId") final long memoryId) {
        AsyncUtil.await(feedbackService.clearFeedback(memoryId));
        return FeedbackResponse.success("Feedback deleted", null);
    }

    @PUT
    @Path("/feedback/{memoryId}/favorite")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public FeedbackResponse setFavorite(@PathParam("memoryId") final long memoryId,
                                        @Valid @NotNull final FavoriteRequest request) {
        final Optional<FeedbackRecord> stored = AsyncUtil.await(feedbackService.setFavorite(memoryId, request.favorite()));
        return FeedbackResponse.success(request.favorite() ? "Added to favorites" : "Removed from favorites",
            stored.orElse(null));
    }

    @GET
    @Path("/favorites")
    @Produces(MediaType.APPLICATION_JSON)
    public FavoritesResponse favorites() {
        return new FavoritesResponse("success", AsyncUtil.await(feedbackService.favorites()));
    }

    @GET
    @Path("/evaluation/metrics")
    @Produces(MediaType.APPLICATION_JSON)
    public FeedbackMetrics metrics() {
        return AsyncUtil.await(feedbackService.metrics());
    }
}
