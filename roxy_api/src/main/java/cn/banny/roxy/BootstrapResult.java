package cn.banny.roxy;

import java.util.List;
import java.util.Map;

/**
 * Outcome of re-establishing listeners from the mapping store.
 */
public interface BootstrapResult {

    /**
     * @return external ports with a running listener after bootstrap
     */
    List<Integer> getStartedPorts();

    /**
     * @return stale mappings skipped because their protocol is not supported
     */
    List<Mapping> getSkipped();

    /**
     * @return external port to the reason its listener could not be started
     */
    Map<Integer, String> getFailures();

}
