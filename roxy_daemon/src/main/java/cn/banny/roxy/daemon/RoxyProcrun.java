package cn.banny.roxy.daemon;

import cn.banny.roxy.server.RoxyServer;
import org.apache.commons.daemon.DaemonContext;
import org.apache.commons.daemon.DaemonController;

import java.util.Scanner;

public class RoxyProcrun {

	private static RoxyDaemon daemon;

	public static void main(final String[] args) throws Exception {
		String action = args.length < 1 ? null : args[0];

		if("stop".equals(action)) {
			if(daemon != null) {
				daemon.stop();
				daemon.destroy();
				daemon = null;
			}
			return;
		}

		daemon = new RoxyDaemon();
		try {
			daemon.init(new ArgumentsContext(args.length < 2 ? new String[0] : new String[]{args[1]}));
			daemon.start();
		} catch(Exception e) {
			e.printStackTrace(System.err);
			daemon.destroy();
			return;
		}

		if("start".equals(action)) {
			return;
		}

		try (Scanner scanner = new Scanner(System.in)) {
			while(scanner.hasNextLine()) {
				String line = scanner.nextLine().trim();
				if("exit".equalsIgnoreCase(line) ||
						"quit".equalsIgnoreCase(line)) {
					break;
				}

				RoxyServer server = daemon.getServer();
				if("status".equalsIgnoreCase(line)) {
					StatusTable.printStatus(System.out, server.getStatus());
				}
				if("show".equalsIgnoreCase(line)) {
					StatusTable.printMappings(System.out, server.getMappings());
				}
			}
		} finally {
			daemon.stop();
			daemon.destroy();
		}
	}

	private static class ArgumentsContext implements DaemonContext {
		private final String[] arguments;
		ArgumentsContext(String[] arguments) {
			this.arguments = arguments;
		}
		@Override
		public DaemonController getController() {
			return null;
		}
		@Override
		public String[] getArguments() {
			return arguments;
		}
	}

}
