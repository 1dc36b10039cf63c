package cn.banny.roxy;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Entry points the core offers to the request front end, the process supervisor and the
 * status display.
 */
public interface PortForwardService {

	/**
	 * Resolves the external port for the pair and makes sure a listener forwards it to the
	 * protocol port of <code>host</code>.
	 * @throws UnsupportedProtocolException before anything is allocated or started
	 * @throws IOException if persisting the mapping or binding the listener failed
	 */
	int requestForward(String host, String protocol) throws IOException;

	/**
	 * Deletes the mapping of the pair and stops its listener.
	 * @return <code>true</code> if a mapping was deleted
	 */
	boolean removeForward(String host, String protocol) throws IOException;

	Set<Mapping> getMappings();

	/**
	 * @return active listeners sorted by port
	 */
	List<ProxyStatus> getStatus();

	/**
	 * Starts a listener for every recorded mapping. Ports already forwarded to the same
	 * target are left untouched.
	 */
	BootstrapResult bootstrap();

	/**
	 * Stops every active listener.
	 */
	void shutdown();

}
