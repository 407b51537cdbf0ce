package com.flamingo.ai.papersearch.service.chunking;

import com.flamingo.ai.papersearch.domain.enums.ChunkType;

/**
 * A chunk before embedding.
 *
 * @param ordinal position of the chunk within the document (0-based)
 * @param text the chunk text
 * @param section label of the section the chunk was cut from
 * @param pageNumber 1-based page the chunk starts on, or null
 * @param chunkType content type of the chunk
 */
public record RawChunk(
    int ordinal, String text, String section, Integer pageNumber, ChunkType chunkType) {}
