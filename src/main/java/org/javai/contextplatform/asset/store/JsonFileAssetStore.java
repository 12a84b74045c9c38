package org.javai.contextplatform.asset.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import org.javai.contextplatform.asset.AssetKey;
import org.javai.contextplatform.asset.AssetType;
import org.javai.contextplatform.asset.ContextAsset;
import org.javai.contextplatform.asset.RevisionEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-backed {@link AssetStore} that keeps every asset version as a discrete JSON document.
 *
 * <h2>Layout</h2>
 * <pre>
 * &lt;root&gt;/&lt;connection&gt;/&lt;type&gt;/&lt;canonical key&gt;/1.0.0.json
 * &lt;root&gt;/&lt;connection&gt;/&lt;type&gt;/&lt;canonical key&gt;/1.1.0.json
 * &lt;root&gt;/&lt;connection&gt;/&lt;type&gt;/&lt;canonical key&gt;/history.jsonl
 * </pre>
 *
 * <p>Path segments are URL-encoded. Version documents are replaced atomically (write to a
 * temporary file, then move); history is appended one JSON line per transition. All state is
 * read back on construction and served from memory afterwards.</p>
 */
public class JsonFileAssetStore extends InMemoryAssetStore {

	private static final Logger logger = LoggerFactory.getLogger(JsonFileAssetStore.class);

	static final String HISTORY_FILE = "history.jsonl";
	private static final String VERSION_SUFFIX = ".json";

	private final Path root;
	private final ObjectMapper mapper;
	private final ObjectWriter documentWriter;
	private final ObjectWriter lineWriter;

	public JsonFileAssetStore(Path root) {
		this.root = Objects.requireNonNull(root, "root must not be null");
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
		this.documentWriter = mapper.writerWithDefaultPrettyPrinter();
		this.lineWriter = mapper.writer();
		load();
	}

	public Path root() {
		return root;
	}

	@Override
	protected void writeAsset(ContextAsset asset) {
		Path target = versionFile(asset);
		try {
			Files.createDirectories(target.getParent());
			Path tmp = Files.createTempFile(target.getParent(), ".asset-", ".tmp");
			try {
				Files.write(tmp, documentWriter.writeValueAsBytes(asset));
				move(tmp, target);
			} finally {
				Files.deleteIfExists(tmp);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to write context asset " + asset.key() + "@" + asset.version(), e);
		}
	}

	@Override
	protected void writeHistory(AssetKey key, RevisionEntry entry) {
		Path file = identityDir(key).resolve(HISTORY_FILE);
		try {
			Files.createDirectories(file.getParent());
			String line = lineWriter.writeValueAsString(entry) + System.lineSeparator();
			Files.writeString(file, line, StandardCharsets.UTF_8,
					StandardOpenOption.CREATE, StandardOpenOption.APPEND);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to append history for " + key, e);
		}
	}

	@Override
	protected void deleteAsset(ContextAsset asset) {
		try {
			Files.deleteIfExists(versionFile(asset));
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to delete context asset " + asset.key() + "@" + asset.version(), e);
		}
	}

	private void load() {
		if (!Files.isDirectory(root)) {
			logger.debug("Asset store root {} does not exist yet; starting empty", root);
			return;
		}
		List<ContextAsset> assets = new ArrayList<>();
		Map<AssetKey, List<RevisionEntry>> history = new HashMap<>();
		try (Stream<Path> files = Files.walk(root, 4)) {
			for (Path file : files.filter(Files::isRegularFile).toList()) {
				String name = file.getFileName().toString();
				if (name.equals(HISTORY_FILE)) {
					history.put(keyOf(file.getParent()), readHistory(file));
				} else if (name.endsWith(VERSION_SUFFIX)) {
					assets.add(mapper.readValue(file.toFile(), ContextAsset.class));
				}
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to load asset store from " + root, e);
		}
		restore(assets, history);
		logger.info("Loaded {} context asset versions ({} identities with history) from {}",
				assets.size(), history.size(), root);
	}

	private List<RevisionEntry> readHistory(Path file) throws IOException {
		List<RevisionEntry> entries = new ArrayList<>();
		for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
			if (!line.isBlank()) {
				entries.add(mapper.readValue(line, RevisionEntry.class));
			}
		}
		return entries;
	}

	private Path versionFile(ContextAsset asset) {
		return identityDir(asset.key()).resolve(asset.version() + VERSION_SUFFIX);
	}

	private Path identityDir(AssetKey key) {
		return root.resolve(encode(key.connectionId()))
				.resolve(key.assetType().id())
				.resolve(encode(key.canonicalKey()));
	}

	private AssetKey keyOf(Path identityDir) {
		Path typeDir = identityDir.getParent();
		Path connectionDir = typeDir.getParent();
		return new AssetKey(
				decode(connectionDir.getFileName().toString()),
				AssetType.fromId(typeDir.getFileName().toString()),
				decode(identityDir.getFileName().toString()));
	}

	private static void move(Path from, Path to) throws IOException {
		try {
			Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, falling back to replace", to);
			Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static String encode(String segment) {
		// "." and ".." would resolve to a parent directory
		return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace(".", "%2E");
	}

	private static String decode(String segment) {
		return URLDecoder.decode(segment, StandardCharsets.UTF_8);
	}
}
