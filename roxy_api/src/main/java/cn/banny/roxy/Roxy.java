package cn.banny.roxy;

import java.io.Closeable;

public class Roxy {

	/**
	 * Represents the end-of-file (or stream) value {@value}.
	 */
	public static final int EOF = -1;

	/**
	 * Separates remote host and protocol in a persisted mapping key.
	 */
	public static final char DELIMITER = '|';

	public static void closeQuietly(Closeable closeable) {
		if(closeable == null) {
			return;
		}
		try {
			closeable.close();
		} catch(Throwable ignored) {}
	}

	public static boolean isEmpty(String str) {
		return str == null || str.trim().isEmpty();
	}

	public static String toKey(String host, String protocol) {
		return host + DELIMITER + protocol;
	}

}
