package com.questrail.flysight.bond;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * JsonFileBondStore
 * -----------------------------------------------------------------------------
 * {@link BondStore} backed by a small JSON document:
 *
 * <pre>
 *   { "bondedDeviceIDs": [ "id-1", "id-2" ] }
 * </pre>
 *
 * <p>Other top-level members of the document are preserved on save. A missing
 * file reads as an empty set. Saves go through a sibling temporary file that is
 * moved over the target, so a crash mid-save leaves the previous document
 * intact.</p>
 */
public final class JsonFileBondStore implements BondStore
{
    public static final String DEFAULT_KEY = "bondedDeviceIDs";

    private static final Logger log = LoggerFactory.getLogger(JsonFileBondStore.class);

    private final Path file;
    private final String key;
    private final Gson gson;

    public JsonFileBondStore(Path file) {
        this(file, DEFAULT_KEY);
    }

    public JsonFileBondStore(Path file, String key) {
        this.file = Objects.requireNonNull(file, "file");
        this.key = Objects.requireNonNull(key, "key");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public Path file() {
        return file;
    }

    @Override
    public Set<String> loadIdentifiers() {
        if (!Files.exists(file)) {
            return Set.of();
        }

        JsonObject root = readDocument();
        JsonElement element = root.get(key);
        if (element == null || element.isJsonNull()) {
            return Set.of();
        }
        if (!element.isJsonArray()) {
            throw new BondStoreException("'" + key + "' in " + file + " is not an array", null);
        }

        Set<String> ids = new LinkedHashSet<>();
        for (JsonElement item : element.getAsJsonArray()) {
            if (item.isJsonPrimitive() && item.getAsJsonPrimitive().isString()) {
                ids.add(item.getAsString());
            } else {
                log.warn("Ignoring non-string bond entry {} in {}", item, file);
            }
        }
        return Collections.unmodifiableSet(ids);
    }

    @Override
    public void saveIdentifiers(Set<String> identifiers) {
        Objects.requireNonNull(identifiers, "identifiers");

        JsonObject root = Files.exists(file) ? readDocument() : new JsonObject();
        JsonArray array = new JsonArray();
        // Sorted for a stable document.
        for (String id : new TreeSet<>(identifiers)) {
            array.add(id);
        }
        root.add(key, array);

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(root, writer);
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new BondStoreException("Failed to write bond set to " + file, e);
        }

        log.debug("Saved {} bonded device(s) to {}", identifiers.size(), file);
    }

    private JsonObject readDocument() {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (parsed.isJsonNull()) {
                return new JsonObject();
            }
            if (!parsed.isJsonObject()) {
                throw new BondStoreException(file + " does not hold a JSON object", null);
            }
            return parsed.getAsJsonObject();
        } catch (IOException | JsonParseException e) {
            throw new BondStoreException("Failed to read bond set from " + file, e);
        }
    }
}
