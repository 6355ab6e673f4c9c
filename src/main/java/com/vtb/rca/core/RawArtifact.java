package com.vtb.rca.core;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Загруженный, но еще не нормализованный артефакт.
 * У структурированных заполнен json, у текстовых text.
 */
@Value
@Builder
public class RawArtifact {
    ArtifactType type;
    String name;
    JsonNode json;
    String text;
    
    public static RawArtifact structured(ArtifactType type, String name, JsonNode json) {
        return RawArtifact.builder().type(type).name(name).json(json).build();
    }
    
    public static RawArtifact document(ArtifactType type, String name, String text) {
        return RawArtifact.builder().type(type).name(name).text(text).build();
    }
}
