package cn.banny.roxy.daemon;

import cn.banny.roxy.Mapping;
import cn.banny.roxy.server.RoxyServer;
import junit.framework.TestCase;
import org.apache.commons.daemon.DaemonContext;
import org.apache.commons.daemon.DaemonController;
import org.apache.commons.io.FileUtils;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

public class RoxyDaemonTest extends TestCase {

	private File dir;

	@Override
	protected void setUp() throws Exception {
		super.setUp();

		dir = Files.createTempDirectory("roxy-daemon").toFile();
	}

	@Override
	protected void tearDown() throws Exception {
		FileUtils.deleteQuietly(dir);

		super.tearDown();
	}

	private static DaemonContext context(final String... arguments) {
		return new DaemonContext() {
			@Override
			public DaemonController getController() {
				return null;
			}
			@Override
			public String[] getArguments() {
				return arguments;
			}
		};
	}

	public void testLifecycleRestoresMappings() throws Exception {
		int port;
		try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
			port = socket.getLocalPort();
		}
		File mappingFile = new File(dir, "port_mappings.json");
		FileUtils.writeStringToFile(mappingFile, "{\"127.0.0.1|http\":" + port + "}", StandardCharsets.UTF_8);
		File config = new File(dir, "config.xml");
		FileUtils.writeStringToFile(config, "<roxy>" +
				"<store file=\"" + mappingFile.getAbsolutePath() + "\"/>" +
				"<proxy bindLocal=\"true\" stopTimeout=\"2000\"/>" +
				"</roxy>", StandardCharsets.UTF_8);

		RoxyDaemon daemon = new RoxyDaemon();
		daemon.init(context(config.getAbsolutePath()));
		RoxyServer server = daemon.getServer();
		try {
			daemon.start();
			assertEquals(1, server.getStatus().size());
			assertEquals(port, server.getStatus().get(0).getPort());
			assertEquals(80, server.getStatus().get(0).getTargetPort());

			ByteArrayOutputStream baos = new ByteArrayOutputStream();
			StatusTable.printStatus(new PrintStream(baos, true, "UTF-8"), server.getStatus());
			String table = new String(baos.toByteArray(), StandardCharsets.UTF_8);
			assertTrue(table, table.contains(String.valueOf(port)));
			assertTrue(table, table.contains("1 active proxy"));
		} finally {
			daemon.stop();
			daemon.destroy();
		}
		assertTrue(server.getStatus().isEmpty());
		assertNull(daemon.getServer());
	}

	public void testMissingConfigFallsBackToBundledConfig() throws Exception {
		RoxyDaemon daemon = new RoxyDaemon();
		daemon.init(context(new File(dir, "missing.xml").getAbsolutePath()));
		assertNotNull(daemon.getServer());
		daemon.destroy();

		assertEquals(10000, RoxyDaemon.loadConfig(new File(dir, "missing.xml")).getStartPort());
	}

	public void testPrintMappingsKeepsRecordsSharingAPort() throws Exception {
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		StatusTable.printMappings(new PrintStream(baos, true, "UTF-8"), Arrays.asList(
				new Mapping("10.0.0.5", "ssh", 10000),
				new Mapping("10.0.0.6", "ssh", 10000)));
		String text = new String(baos.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(text, text.contains("10.0.0.5"));
		assertTrue(text, text.contains("10.0.0.6"));
		assertTrue(text, text.contains("2 port mappings configured"));
	}

	public void testPrintMappings() throws Exception {
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(baos, true, "UTF-8");
		StatusTable.printMappings(out, Collections.<Mapping>emptySet());
		StatusTable.printMappings(out, Collections.singleton(new Mapping("10.0.0.5", "gopher", 10001)));
		String text = new String(baos.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(text, text.contains("No port mappings configured"));
		assertTrue(text, text.contains("gopher"));
		assertTrue(text, text.contains("1 port mapping configured"));
	}

}
