package com.vtb.rca.extractors;

import com.vtb.rca.core.SourceDataset;
import com.vtb.rca.models.Finding;
import com.vtb.rca.models.FindingCategory;

import java.util.List;

/**
 * Интерфейс для экстракторов находок
 */
public interface FindingExtractor {
    
    /**
     * Категория находок, которую производит экстрактор
     */
    FindingCategory getCategory();
    
    /**
     * Нормализовать сырые записи в находки
     *
     * Для корректного, но неполного документа не бросает исключений:
     * отсутствующие поля заменяются на "unknown".
     *
     * @param dataset загруженные артефакты
     * @param context целевой сервис и сборщик предупреждений
     */
    List<Finding> extract(SourceDataset dataset, ExtractionContext context);
}
