package com.github.statecharts;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Invoked when a dispatch cycle reaches {@link StateId#CANNOT_HAPPEN} or a destination outside the
 * machine's state table. Both denote an authoring defect in the chart, so the default handler
 * terminates the JVM.
 */
@FunctionalInterface
public interface FatalErrorHandler {

  FatalErrorHandler EXIT = new FatalErrorHandler() {
    private final Logger logger = LogManager.getLogger(FatalErrorHandler.class.getSimpleName());

    @Override
    public void onFatal(final String machineId, final String reason) {
      logger.fatal("[m:" + machineId + "] " + reason + ". Aborting!");
      LogManager.shutdown();
      System.exit(1);
    }
  };

  void onFatal(final String machineId, final String reason);
}
