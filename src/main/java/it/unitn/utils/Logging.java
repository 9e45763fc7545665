package it.unitn.utils;

import org.slf4j.Logger;

public interface Logging {

    static <S, E, T> T logging(Logger logger, S state, E event, T result) {
        logger.debug("\n\t[{}]\n  ,\t[{}]\n ->\t[{}]", state, event, result);
        return result;
    }

    static <S, T> T logging(Logger logger, S state, T result) {
        logger.debug("\n\t[{}]\n ->\t[{}]", state, result);
        return result;
    }

}
