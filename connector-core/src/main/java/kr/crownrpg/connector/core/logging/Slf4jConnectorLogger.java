package kr.crownrpg.connector.core.logging;

import kr.crownrpg.connector.api.logging.ConnectorLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.Objects;

/**
 * SLF4J로 내보내는 기본 {@link ConnectorLogger}. fatal은 {@code FATAL} 마커를 단 error로 기록한다.
 */
public final class Slf4jConnectorLogger implements ConnectorLogger {

    public static final Marker FATAL = MarkerFactory.getMarker("FATAL");

    private final Logger logger;

    public Slf4jConnectorLogger(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public static ConnectorLogger forClass(Class<?> type) {
        return new Slf4jConnectorLogger(LoggerFactory.getLogger(type));
    }

    @Override
    public void debug(String message) {
        logger.debug(message);
    }

    @Override
    public void info(String message) {
        logger.info(message);
    }

    @Override
    public void warning(String message) {
        logger.warn(message);
    }

    @Override
    public void error(String message) {
        logger.error(message);
    }

    @Override
    public void fatal(String message) {
        logger.error(FATAL, message);
    }
}
