package cn.banny.roxy.daemon;

import cn.banny.roxy.BootstrapResult;
import cn.banny.roxy.Roxy;
import cn.banny.roxy.server.RoxyConfig;
import cn.banny.roxy.server.RoxyServer;
import org.apache.commons.daemon.Daemon;
import org.apache.commons.daemon.DaemonContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;

public class RoxyDaemon implements Daemon {

	private static final Logger log = LoggerFactory.getLogger(RoxyDaemon.class);

	static final String DEFAULT_CONFIG = "config.xml";

	private RoxyServer server;

	public RoxyServer getServer() {
		return server;
	}

	/* (non-Javadoc)
	 * @see org.apache.commons.daemon.Daemon#init(org.apache.commons.daemon.DaemonContext)
	 */
	@Override
	public void init(DaemonContext context) throws Exception {
		String[] args = context == null ? null : context.getArguments();
		File file = new File(args == null || args.length < 1 ? DEFAULT_CONFIG : args[0]);
		server = RoxyServer.create(loadConfig(file));
	}

	static RoxyConfig loadConfig(File file) throws Exception {
		InputStream inputStream = file.isFile() ? new FileInputStream(file) : RoxyDaemon.class.getResourceAsStream("/" + DEFAULT_CONFIG);
		if (inputStream == null) {
			log.info("{} not found, using defaults", file);
			return new RoxyConfig();
		}
		try {
			RoxyConfig config = RoxyConfigParser.parse(inputStream);
			log.debug("loadConfig: file={}, config={}", file, config);
			return config;
		} finally {
			Roxy.closeQuietly(inputStream);
		}
	}

	/* (non-Javadoc)
	 * @see org.apache.commons.daemon.Daemon#start()
	 */
	@Override
	public void start() throws Exception {
		if (server == null) {
			throw new IllegalStateException("init not called");
		}
		BootstrapResult result = server.bootstrap();
		for (Integer port : result.getFailures().keySet()) {
			log.warn("Proxy on port {} not started: {}", port, result.getFailures().get(port));
		}
	}

	/* (non-Javadoc)
	 * @see org.apache.commons.daemon.Daemon#stop()
	 */
	@Override
	public void stop() {
		if (server != null) {
			server.shutdown();
		}
	}

	/* (non-Javadoc)
	 * @see org.apache.commons.daemon.Daemon#destroy()
	 */
	@Override
	public void destroy() {
		server = null;
	}

}
