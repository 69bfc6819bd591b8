package ru.aritmos.provisioningbroker.token;

/**
 * Вид учётных данных, получаемых заданием.
 */
public enum TokenKind {
    /** краткоживущий bearer-токен API консоли (заголовок authorization) */
    BEARER,
    /** токен сессии (заголовок token-id) */
    SESSION,
    /** долгоживущий токен интеграции, создаваемый мастером */
    INTEGRATION,
    /** refresh-токен, найденный в хранилище браузера */
    REFRESH
}
