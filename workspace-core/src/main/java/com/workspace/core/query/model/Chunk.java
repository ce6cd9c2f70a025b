package com.workspace.core.query.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One normalized retrieval snippet. {@code idx} is 1-based and contiguous within a result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Chunk {
    private int idx;
    private String source;
    private Integer page;
    @JsonProperty("chunk_id")
    private String chunkId;
    private String text;
}
