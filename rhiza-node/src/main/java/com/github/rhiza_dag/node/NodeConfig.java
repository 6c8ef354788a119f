// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.node;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.rhiza_dag.crypto.PublicKey;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

/// Node settings kept as JSON. Missing fields take their defaults and unknown fields are ignored so that a config
/// written for a node with a network front end still loads.
///
/// @param name             Display name.
/// @param dataDir          Where the journal lives. A leading `~` is the user's home directory.
/// @param journalFile      The MVStore file name within `dataDir`.
/// @param founderPublicKey Hex of the key that receives the founder allocation. Empty means this node's own key.
/// @param logAtLevel       The JUL level name for rewards, genesis creation and finality.
public record NodeConfig(String name,
                         String dataDir,
                         String journalFile,
                         String founderPublicKey,
                         String logAtLevel) {

  public static final String DEFAULT_NAME = "rhiza-node";
  public static final String DEFAULT_DATA_DIR = "~/.rhiza";
  public static final String DEFAULT_JOURNAL_FILE = "journal.mv.db";
  public static final String DEFAULT_LOG_AT_LEVEL = "INFO";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .enable(SerializationFeature.INDENT_OUTPUT);

  public NodeConfig {
    name = Objects.requireNonNullElse(name, DEFAULT_NAME);
    dataDir = Objects.requireNonNullElse(dataDir, DEFAULT_DATA_DIR);
    journalFile = Objects.requireNonNullElse(journalFile, DEFAULT_JOURNAL_FILE);
    founderPublicKey = Objects.requireNonNullElse(founderPublicKey, "");
    logAtLevel = Objects.requireNonNullElse(logAtLevel, DEFAULT_LOG_AT_LEVEL);
    if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
    if (journalFile.isBlank()) throw new IllegalArgumentException("journalFile must not be blank");
    if (!founderPublicKey.isEmpty()) {
      // fail at load time rather than at genesis
      PublicKey.fromHex(founderPublicKey);
    }
    Level.parse(logAtLevel);
  }

  public static NodeConfig defaults() {
    return new NodeConfig(null, null, null, null, null);
  }

  /// The JSON shape on disk.
  static class JsonNodeConfig {
    public String name;
    public String dataDir;
    public String journalFile;
    public String founderPublicKey;
    public String logAtLevel;
  }

  /// @throws IOException if the file cannot be read or is not valid JSON
  /// @throws IllegalArgumentException if a value is out of range
  public static NodeConfig load(Path path) throws IOException {
    final var json = MAPPER.readValue(path.toFile(), JsonNodeConfig.class);
    return new NodeConfig(json.name, json.dataDir, json.journalFile, json.founderPublicKey, json.logAtLevel);
  }

  public void save(Path path) throws IOException {
    final var json = new JsonNodeConfig();
    json.name = name;
    json.dataDir = dataDir;
    json.journalFile = journalFile;
    json.founderPublicKey = founderPublicKey;
    json.logAtLevel = logAtLevel;
    final var parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    MAPPER.writeValue(path.toFile(), json);
  }

  public Path dataPath() {
    if (dataDir.equals("~") || dataDir.startsWith("~/")) {
      return Path.of(System.getProperty("user.home"), dataDir.substring(1).replaceFirst("^/", ""));
    }
    return Path.of(dataDir);
  }

  public Path journalPath() {
    return dataPath().resolve(journalFile);
  }

  public Optional<PublicKey> founderKey() {
    return founderPublicKey.isEmpty() ? Optional.empty() : Optional.of(PublicKey.fromHex(founderPublicKey));
  }

  public Level level() {
    return Level.parse(logAtLevel);
  }
}
