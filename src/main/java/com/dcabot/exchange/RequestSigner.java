package com.dcabot.exchange;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

/**
 * Bybit V5 request signature: lowercase hex HMAC-SHA256 of {@code timestamp + apiKey + recvWindow + payload},
 * where the payload is the query string of a GET or the JSON body of a POST.
 */
@Component
public class RequestSigner {

	private static final String HMAC = "HmacSHA256";
	private static final HexFormat HEX = HexFormat.of();

	public String sign(long timestamp, String apiKey, long recvWindow, String payload, String secretKey) {
		String prehash = new StringBuilder()
				.append(timestamp)
				.append(apiKey)
				.append(recvWindow)
				.append(payload == null ? "" : payload)
				.toString();
		return hmacHex(prehash, secretKey);
	}

	String hmacHex(String message, String secretKey) {
		if (secretKey == null || secretKey.isEmpty()) {
			throw new IllegalStateException("Bybit secret key is not configured");
		}
		try {
			Mac mac = Mac.getInstance(HMAC);
			mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), HMAC));
			return HEX.formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
		} catch (GeneralSecurityException ex) {
			throw new IllegalStateException("Unable to sign Bybit request", ex);
		}
	}
}
