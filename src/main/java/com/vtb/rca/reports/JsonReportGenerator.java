package com.vtb.rca.reports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.rca.models.AnalysisResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {
    
    private final ObjectMapper objectMapper;
    
    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }
    
    @Override
    public void generate(AnalysisResult result, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);
        
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, render(result), StandardCharsets.UTF_8);
        
        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }
    
    /**
     * Сериализовать результат в строку
     */
    public String render(AnalysisResult result) throws JsonProcessingException {
        if (result == null) {
            throw new IllegalArgumentException("AnalysisResult не может быть null");
        }
        return objectMapper.writeValueAsString(result);
    }
    
    @Override
    public String getFileExtension() {
        return "json";
    }
}
