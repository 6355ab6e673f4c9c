package com.vtb.rca.reports;

import com.vtb.rca.models.AnalysisResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов
 */
public interface ReportGenerator {
    
    /**
     * Сгенерировать отчет
     * 
     * @param result результат анализа
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    void generate(AnalysisResult result, Path outputPath) throws IOException;
    
    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}
