package com.dcabot.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RequestSignerTest {

	private final RequestSigner signer = new RequestSigner();

	@Test
	void hmacMatchesKnownVector() {
		// RFC 4231 test case 2
		assertThat(signer.hmacHex("what do ya want for nothing?", "Jefe"))
				.isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
	}

	@Test
	void signatureCoversTimestampKeyWindowAndPayload() {
		String signed = signer.sign(1_700_000_000_000L, "key", 5000L, "category=linear", "secret");

		assertThat(signed).hasSize(64).matches("[0-9a-f]+");
		assertThat(signed).isEqualTo(signer.hmacHex("1700000000000key5000category=linear", "secret"));
		assertThat(signed).isNotEqualTo(signer.sign(1_700_000_000_001L, "key", 5000L, "category=linear", "secret"));
		assertThat(signer.sign(1L, "key", 5000L, null, "secret")).isEqualTo(signer.hmacHex("1key5000", "secret"));
	}

	@Test
	void missingSecretIsRejected() {
		assertThatThrownBy(() -> signer.sign(1L, "key", 5000L, "", ""))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("secret key");
	}
}
