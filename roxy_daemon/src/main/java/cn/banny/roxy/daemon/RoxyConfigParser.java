package cn.banny.roxy.daemon;

import cn.banny.roxy.server.RoxyConfig;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.File;
import java.io.InputStream;

/**
 * Reads <code>config.xml</code>:
 * <pre>
 * &lt;roxy debug="false"&gt;
 *     &lt;store file="port_mappings.json" startPort="10000"/&gt;
 *     &lt;proxy bindLocal="false" connectTimeout="30000" stopTimeout="5000" closeConnectionsOnStop="false"/&gt;
 * &lt;/roxy&gt;
 * </pre>
 * Missing attributes keep their {@link RoxyConfig} defaults.
 */
public class RoxyConfigParser extends DefaultHandler {

	private RoxyConfig config;

	public RoxyConfig getConfig() {
		return config;
	}

	public static RoxyConfig parse(InputStream inputStream) throws Exception {
		SAXParserFactory factory = SAXParserFactory.newInstance();
		SAXParser parser = factory.newSAXParser();
		RoxyConfigParser configParser = new RoxyConfigParser();
		parser.parse(inputStream, configParser);
		return configParser.getConfig();
	}

	@Override
	public void startDocument() throws SAXException {
		super.startDocument();

		config = new RoxyConfig();
	}

	@Override
	public void startElement(String uri, String localName, String qName,
			Attributes attributes) throws SAXException {
		super.startElement(uri, localName, qName, attributes);

		if("roxy".equals(qName)) {
			boolean debug = Boolean.parseBoolean(attributes.getValue("debug"));
			config.setDebug(debug);
			if (debug) {
				Logger.getRootLogger().addAppender(new ConsoleAppender(new PatternLayout("%5p [%t] (%F:%L) - %m%n")));
				Logger.getRootLogger().setLevel(Level.DEBUG);
			}
			return;
		}

		if("store".equals(qName)) {
			String file = attributes.getValue("file");
			if (file != null) {
				config.setMappingFile(new File(file));
			}
			String startPort = attributes.getValue("startPort");
			if (startPort != null) {
				config.setStartPort(parseInt(qName, "startPort", startPort));
			}
			return;
		}

		if("proxy".equals(qName)) {
			String bindLocal = attributes.getValue("bindLocal");
			if (bindLocal != null) {
				config.setBindLocal(Boolean.parseBoolean(bindLocal));
			}
			String connectTimeout = attributes.getValue("connectTimeout");
			if (connectTimeout != null) {
				config.setConnectTimeout(parseInt(qName, "connectTimeout", connectTimeout));
			}
			String stopTimeout = attributes.getValue("stopTimeout");
			if (stopTimeout != null) {
				config.setStopTimeout(parseInt(qName, "stopTimeout", stopTimeout));
			}
			String closeConnections = attributes.getValue("closeConnectionsOnStop");
			if (closeConnections != null) {
				config.setCloseConnectionsOnStop(Boolean.parseBoolean(closeConnections));
			}
		}
	}

	private int parseInt(String element, String attribute, String value) throws SAXException {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new SAXException("Invalid " + element + "/@" + attribute + ": " + value, e);
		}
	}

}
