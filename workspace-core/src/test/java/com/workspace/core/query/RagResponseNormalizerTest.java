package com.workspace.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workspace.core.query.model.Chunk;
import com.workspace.core.query.model.RagResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RagResponseNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RagResponseNormalizer normalizer = new RagResponseNormalizer();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void normalize_shouldReadResultsListWithFallbackSource() throws Exception {
        JsonNode response = json("{\"results\":[{\"text\":\"Newton's second law\"}]}");

        RagResult result = normalizer.normalize(response, 8);

        assertThat(result.getAnswer()).isEmpty();
        assertThat(result.getChunks()).hasSize(1);
        Chunk chunk = result.getChunks().get(0);
        assertThat(chunk.getIdx()).isEqualTo(1);
        assertThat(chunk.getSource()).isEqualTo("chunk");
        assertThat(chunk.getText()).isEqualTo("Newton's second law");
        assertThat(chunk.getPage()).isNull();
        assertThat(chunk.getChunkId()).isNull();
        assertThat(result.getRaw()).isSameAs(response);
    }

    @ParameterizedTest
    @ValueSource(strings = {"chunks", "retrieved", "results"})
    void normalize_shouldGiveSameChunksWhicheverListKeyIsUsed(String key) throws Exception {
        JsonNode response = json("{\"answer\":\"F = ma\",\"" + key + "\":["
            + "{\"content\":\"first\",\"metadata\":{\"source\":\"mech.pdf\",\"page\":3,\"chunk_id\":\"c-1\"}},"
            + "{\"page_content\":\"second\",\"metadata\":{\"file_name\":\"notes.md\",\"page\":\"7\"}}]}");

        RagResult result = normalizer.normalize(response, 8);

        assertThat(result.getAnswer()).isEqualTo("F = ma");
        assertThat(result.getChunks())
            .extracting(Chunk::getIdx, Chunk::getSource, Chunk::getPage, Chunk::getChunkId, Chunk::getText)
            .containsExactly(
                tuple(1, "mech.pdf", 3, "c-1", "first"),
                tuple(2, "notes.md", 7, null, "second"));
    }

    @Test
    void normalize_shouldPreferFirstNonEmptyList() throws Exception {
        JsonNode response = json("{\"chunks\":[],\"retrieved\":[{\"text\":\"from retrieved\"}],"
            + "\"results\":[{\"text\":\"from results\"}]}");

        RagResult result = normalizer.normalize(response, 8);

        assertThat(result.getChunks()).extracting(Chunk::getText).containsExactly("from retrieved");
    }

    @Test
    void normalize_shouldCapAtTopKAndKeepBackendOrder() throws Exception {
        JsonNode response = json("{\"chunks\":[{\"text\":\"a\"},{\"text\":\"b\"},{\"text\":\"c\"},{\"text\":\"d\"}]}");

        RagResult result = normalizer.normalize(response, 2);

        assertThat(result.getChunks()).extracting(Chunk::getIdx).containsExactly(1, 2);
        assertThat(result.getChunks()).extracting(Chunk::getText).containsExactly("a", "b");
    }

    @Test
    void normalize_shouldTakeBareStringsAsChunkText() throws Exception {
        RagResult result = normalizer.normalize(json("{\"retrieved\":[\"plain snippet\"]}"), 5);

        assertThat(result.getChunks()).singleElement()
            .satisfies(chunk -> {
                assertThat(chunk.getText()).isEqualTo("plain snippet");
                assertThat(chunk.getSource()).isEqualTo("chunk");
            });
    }

    @Test
    void normalize_shouldFallBackThroughTextFields() throws Exception {
        JsonNode response = json("{\"chunks\":["
            + "{\"content\":\"\",\"text\":\"from text\"},"
            + "{\"metadata\":{\"text\":\"from metadata\"}},"
            + "{\"source\":\"empty.pdf\"}]}");

        RagResult result = normalizer.normalize(response, 8);

        assertThat(result.getChunks()).extracting(Chunk::getText)
            .containsExactly("from text", "from metadata", "");
        assertThat(result.getChunks().get(2).getSource()).isEqualTo("empty.pdf");
    }

    @Test
    void normalize_shouldAcceptNumericChunkIdsAndIgnoreNonNumericPages() throws Exception {
        JsonNode response = json("{\"chunks\":[{\"text\":\"x\",\"chunk_id\":42,\"metadata\":{\"page\":\"iv\"}}]}");

        Chunk chunk = normalizer.normalize(response, 8).getChunks().get(0);

        assertThat(chunk.getChunkId()).isEqualTo("42");
        assertThat(chunk.getPage()).isNull();
    }

    @Test
    void normalize_shouldReturnEmptyResultForUnrecognizedShapes() throws Exception {
        assertThat(normalizer.normalize(json("{\"answer\":42,\"items\":[1,2]}"), 8).getChunks()).isEmpty();
        assertThat(normalizer.normalize(json("{\"answer\":42}"), 8).getAnswer()).isEmpty();
        assertThat(normalizer.normalize(json("[{\"text\":\"top-level array\"}]"), 8).getChunks()).isEmpty();
        assertThat(normalizer.normalize(json("\"just text\""), 8).getChunks()).isEmpty();
        assertThat(normalizer.normalize(null, 8).getChunks()).isEmpty();
    }
}
