package br.edu.ifba.hybridrag.evaluation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ChunkQualityEvaluatorTest {

    private final ChunkQualityEvaluator evaluator = new ChunkQualityEvaluator();

    @Test
    void testWellFormedChunkPasses() {
        ChunkEvaluation evaluation = evaluator.evaluate(7,
            "Retrieval augmented generation grounds answers in retrieved documents.");

        assertEquals(1, evaluation.score());
        assertEquals("chunk looks good", evaluation.explanation());
        assertEquals(7L, evaluation.chunkId());
        assertEquals(ChunkQualityEvaluator.CRITERIA, evaluation.criteria());
        assertEquals(ChunkQualityEvaluator.MODEL, evaluation.modelUsed());
    }

    @Test
    void testShortChunk() {
        ChunkEvaluation evaluation = evaluator.evaluate(1, "Too short.");

        assertEquals(0, evaluation.score());
        assertEquals("insufficient content length", evaluation.explanation());
    }

    @Test
    void testFormattingArtifacts() {
        ChunkEvaluation evaluation = evaluator.evaluate(1, "@@@@ #### $$$$ %%%% ^^^^ &&&& **** ==== some text here.");

        assertEquals(0, evaluation.score());
        assertEquals("formatting artifacts detected", evaluation.explanation());
    }

    @Test
    void testUnterminatedShortProseIsIncomplete() {
        ChunkEvaluation evaluation = evaluator.evaluate(1, "this sentence is cut off in the middle of a thought and");

        assertEquals(0, evaluation.score());
        assertEquals("chunk likely incomplete", evaluation.explanation());
    }

    @Test
    void testLongUnterminatedProseIsAccepted() {
        ChunkEvaluation evaluation = evaluator.evaluate(1,
            "dense retrievers encode questions and passages into one vector space so that nearest neighbours answer");

        assertEquals(1, evaluation.score());
    }

    @Test
    void testMissingTextCollectsEveryProblem() {
        ChunkEvaluation evaluation = evaluator.evaluate(1, null);

        assertEquals(0, evaluation.score());
        assertEquals("insufficient content length, chunk likely incomplete", evaluation.explanation());
    }

    @Test
    void testNonWordRatio() {
        assertEquals(1.0 / 3, ChunkQualityEvaluator.nonWordRatio("a@b"), 1e-9);
        assertEquals(0.0, ChunkQualityEvaluator.nonWordRatio(""));
        assertEquals(0.0, ChunkQualityEvaluator.nonWordRatio("Citações (2020): ok-ish; fine."));
    }
}
