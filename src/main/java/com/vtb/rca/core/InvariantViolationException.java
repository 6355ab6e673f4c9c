package com.vtb.rca.core;

/**
 * Нарушение внутреннего инварианта анализа.
 * Это ошибка в логике, а не во входных данных, поэтому запуск прерывается.
 */
public class InvariantViolationException extends RuntimeException {
    
    public InvariantViolationException(String message) {
        super(message);
    }
}
