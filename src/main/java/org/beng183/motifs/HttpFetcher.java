package org.beng183.motifs;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Issues a single bounded HTTP GET and returns the body as text.
 * HTTP 404 is {@link NotFoundException}; any other non-200 status, a timeout or a connection failure is {@link UnavailableException}.
 * @author dmyersturnbull
 */
public class HttpFetcher {

	private static final Logger logger = LogManager.getLogger(HttpFetcher.class.getName());

	private final int connectTimeoutMillis;
	private final int readTimeoutMillis;
	private final String userAgent;

	public HttpFetcher(int connectTimeoutMillis, int readTimeoutMillis, String userAgent) {
		this.connectTimeoutMillis = connectTimeoutMillis;
		this.readTimeoutMillis = readTimeoutMillis;
		this.userAgent = userAgent;
	}

	public String get(String location, String accept) throws LoadException {

		URL url;
		try {
			url = new URL(location);
		} catch (MalformedURLException e) {
			throw new UnavailableException("Bad URL " + location, e);
		}

		logger.debug("Query " + location);
		HttpURLConnection conn = null;
		try {

			conn = (HttpURLConnection) url.openConnection();
			conn.setInstanceFollowRedirects(true);
			conn.setConnectTimeout(connectTimeoutMillis);
			conn.setReadTimeout(readTimeoutMillis);
			conn.setDoInput(true);
			conn.setRequestProperty("User-Agent", userAgent);
			conn.setRequestProperty("Accept", accept);
			logger.trace("Connecting...");
			conn.connect();

			int status = conn.getResponseCode();
			if (status == HttpURLConnection.HTTP_NOT_FOUND) {
				throw new NotFoundException("Got HTTP 404 for " + location);
			}
			if (status != HttpURLConnection.HTTP_OK) {
				throw new UnavailableException("Got HTTP " + status + " (" + conn.getResponseMessage() + ") for " + location);
			}
			logger.trace("Received HTTP 200.");

			StringBuilder sb = new StringBuilder();
			try (InputStream stream = conn.getInputStream();
					BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8.newDecoder()))) {
				String line = "";
				while ((line = br.readLine()) != null) {
					sb.append(line).append('\n');
				}
			}
			return sb.toString();

		} catch (CharacterCodingException e) {
			throw new MalformedDataException("Response from " + location + " is not valid UTF-8", e);
		} catch (SocketTimeoutException e) {
			throw new UnavailableException("Timed out querying " + location, e);
		} catch (IOException e) {
			throw new UnavailableException("Couldn't query " + location, e);
		} finally {
			if (conn != null) conn.disconnect();
		}
	}

}
