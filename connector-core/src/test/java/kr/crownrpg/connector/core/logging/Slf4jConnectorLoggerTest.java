package kr.crownrpg.connector.core.logging;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class Slf4jConnectorLoggerTest {

    @Test
    void levelsMapOntoSlf4j() {
        Logger delegate = mock(Logger.class);
        Slf4jConnectorLogger logger = new Slf4jConnectorLogger(delegate);

        logger.debug("d");
        logger.info("i");
        logger.warning("w");
        logger.error("e");
        logger.fatal("f");

        verify(delegate).debug("d");
        verify(delegate).info("i");
        verify(delegate).warn("w");
        verify(delegate).error("e");
        verify(delegate).error(Slf4jConnectorLogger.FATAL, "f");
    }
}
