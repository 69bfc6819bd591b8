package ru.aritmos.provisioningbroker.wizard;

/**
 * Каким путём получен токен интеграции.
 */
public enum ExtractionPath {
    /** текст диалога с результатом */
    DIRECT,
    /** буфер обмена после нажатия "Copy" */
    CLIPBOARD_FALLBACK,
    /** соседние узлы рядом с кнопкой копирования */
    NEARBY_FALLBACK,
    NONE
}
