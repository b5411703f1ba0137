package com.codeheadsystems.relman.server.keys;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.relman.server.store.PublicSigningKey;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.Test;

class PublicKeyParserTest {

  private final PublicKeyParser parser = new PublicKeyParser();

  @Test
  void parse_readsPrimaryKey() throws Exception {
    TestKeys.Generated generated = TestKeys.generate("Alice Example <alice@apache.org>");

    PublicSigningKey key = parser.parse(generated.armored());

    assertThat(key.fingerprint()).isEqualTo(generated.fingerprint());
    assertThat(key.algorithm()).isEqualTo("RSA");
    assertThat(key.length()).isEqualTo(1024);
    assertThat(key.primaryDeclaredUid()).isEqualTo("Alice Example <alice@apache.org>");
    assertThat(key.secondaryDeclaredUids()).isEmpty();
    assertThat(key.apacheUid()).isEqualTo("alice");
    assertThat(key.expires()).isNull();
    assertThat(key.asciiArmoredKey()).startsWith(PublicKeyParser.BEGIN);
  }

  @Test
  void parse_outsideAddress_noApacheUid() throws Exception {
    PublicSigningKey key = parser.parse(TestKeys.generate("Bob <bob@example.com>").armored());

    assertThat(key.apacheUid()).isNull();
  }

  @Test
  void parse_readsExpiry() throws Exception {
    Instant created = Instant.now().minus(10, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);

    PublicSigningKey key = parser.parse(
        TestKeys.generate("Carol <carol@apache.org>", created, Duration.ofDays(30)).armored());

    assertThat(key.created()).isEqualTo(created);
    assertThat(key.expires()).isEqualTo(created.plus(30, ChronoUnit.DAYS));
  }

  @Test
  void parse_garbage_throws() {
    String broken = PublicKeyParser.BEGIN + "\n\nnot base64 at all !!!\n" + PublicKeyParser.END;

    assertThatThrownBy(() -> parser.parse(broken)).isInstanceOf(KeyParseException.class);
    assertThatThrownBy(() -> parser.parse("  ")).isInstanceOf(KeyParseException.class);
  }

  @Test
  void splitBlocks_dropsCommentsBetweenBlocks() {
    String first = TestKeys.generate("Alice <alice@apache.org>").armored();
    String second = TestKeys.generate("Bob <bob@apache.org>").armored();

    List<String> blocks = parser.splitBlocks(TestKeys.keysFile(List.of(first, second)));

    assertThat(blocks).containsExactly(first.strip(), second.strip());
  }

  @Test
  void splitBlocks_unterminatedBlockRunsToNextHeader() {
    String text = PublicKeyParser.BEGIN + "\nabc\n" + PublicKeyParser.BEGIN + "\ndef\n" + PublicKeyParser.END;

    assertThat(parser.splitBlocks(text))
        .containsExactly(PublicKeyParser.BEGIN + "\nabc", PublicKeyParser.BEGIN + "\ndef\n" + PublicKeyParser.END);
  }

  @Test
  void splitBlocks_edgeCases() {
    assertThat(parser.splitBlocks(null)).isEmpty();
    assertThat(parser.splitBlocks("\n \n")).isEmpty();
    assertThat(parser.splitBlocks(" just some text ")).containsExactly("just some text");
  }

  @Test
  void foundationUid_takesFirstFoundationAddress() {
    assertThat(PublicKeyParser.foundationUid(List.of(
        "Dee <dee@example.org>", "Dee <dee@apache.org>", "Dee <other@apache.org>"))).isEqualTo("dee");
    assertThat(PublicKeyParser.foundationUid(List.of("bare@apache.org"))).isEqualTo("bare");
    assertThat(PublicKeyParser.foundationUid(List.of("@apache.org"))).isNull();
  }

  @Test
  void algorithmName_unknownTag() {
    assertThat(PublicKeyParser.algorithmName(99)).isEqualTo("ALG-99");
    assertThat(PublicKeyParser.algorithmName(17)).isEqualTo("DSA");
  }
}
