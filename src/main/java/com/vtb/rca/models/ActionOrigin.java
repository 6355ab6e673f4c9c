package com.vtb.rca.models;

/**
 * Откуда взялось действие: из находки или из стандартного шаблона практик
 */
public enum ActionOrigin {
    FINDING,
    TEMPLATE
}
