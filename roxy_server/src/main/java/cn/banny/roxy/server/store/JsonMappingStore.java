package cn.banny.roxy.server.store;

import cn.banny.roxy.Mapping;
import cn.banny.roxy.MappingStore;
import cn.banny.roxy.PortAllocator;
import cn.banny.roxy.Protocol;
import cn.banny.roxy.Roxy;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.fastjson.parser.Feature;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps all mappings in one JSON object, <code>{"host|protocol": port}</code>.
 * <p>
 * Every read-modify-write runs under a single lock, so two callers resolving the same new
 * pair see one allocation.
 */
public class JsonMappingStore implements MappingStore {

    private static final Logger log = LoggerFactory.getLogger(JsonMappingStore.class);

    public static final String DEFAULT_FILE = "port_mappings.json";

    private final File file;
    private final PortAllocator allocator;

    private final ReentrantLock lock = new ReentrantLock();

    public JsonMappingStore(File file, PortAllocator allocator) {
        this.file = file;
        this.allocator = allocator;
    }

    @Override
    public int resolve(String host, Protocol protocol) throws IOException {
        if (Roxy.isEmpty(host)) {
            throw new IllegalArgumentException("host is empty");
        }

        lock.lock();
        try {
            Set<Mapping> mappings = load();
            for (Mapping mapping : mappings) {
                if (mapping.matches(host, protocol.getName())) {
                    return mapping.getExternalPort();
                }
            }

            int port = allocator.nextPort(mappings);
            Mapping created = new Mapping(host, protocol, port);
            mappings.add(created);
            persist(mappings);
            log.info("allocated {}", created);
            return port;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<Mapping> load() {
        lock.lock();
        try {
            return readMappings();
        } finally {
            lock.unlock();
        }
    }

    private Set<Mapping> readMappings() {
        Set<Mapping> mappings = new LinkedHashSet<>();
        if (!file.isFile()) {
            return mappings;
        }

        String json;
        try {
            json = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("{} is unreadable. Starting with an empty mapping.", file, e);
            return mappings;
        }
        if (Roxy.isEmpty(json)) {
            log.warn("{} is empty. Starting with an empty mapping.", file);
            return mappings;
        }

        JSONObject object;
        try {
            object = JSON.parseObject(json, Feature.OrderedField);
        } catch (JSONException | ClassCastException e) {
            log.warn("{} contains invalid JSON. Starting with an empty mapping.", file, e);
            return mappings;
        }
        if (object == null) {
            return mappings;
        }

        Set<Integer> ports = new TreeSet<>();
        for (Map.Entry<String, Object> entry : object.entrySet()) {
            Mapping mapping = parseEntry(entry.getKey(), entry.getValue());
            if (mapping == null) {
                continue;
            }
            if (!ports.add(mapping.getExternalPort())) {
                log.warn("External port {} of '{}' in {} is already taken, dropped", mapping.getExternalPort(), entry.getKey(), file);
                continue;
            }
            mappings.add(mapping);
        }
        return mappings;
    }

    private Mapping parseEntry(String key, Object value) {
        int index = key.lastIndexOf(Roxy.DELIMITER);
        if (index <= 0 || index == key.length() - 1) {
            log.warn("Malformed mapping key '{}' in {}, dropped", key, file);
            return null;
        }
        if (!(value instanceof Integer)) {
            log.warn("Malformed port {} for key '{}' in {}, dropped", value, key, file);
            return null;
        }
        try {
            return new Mapping(key.substring(0, index), key.substring(index + 1), (Integer) value);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed mapping '{}'={} in {}, dropped", key, value, file, e);
            return null;
        }
    }

    @Override
    public void persist(Collection<Mapping> mappings) throws IOException {
        Map<String, Integer> object = new LinkedHashMap<>();
        Set<Integer> ports = new TreeSet<>();
        for (Mapping mapping : mappings) {
            if (!ports.add(mapping.getExternalPort())) {
                throw new IllegalArgumentException("Duplicate external port: " + mapping);
            }
            if (object.put(mapping.getKey(), mapping.getExternalPort()) != null) {
                throw new IllegalArgumentException("Duplicate mapping key: " + mapping);
            }
        }

        lock.lock();
        try {
            File dir = file.getAbsoluteFile().getParentFile();
            File tmp = new File(dir, file.getName() + ".tmp");
            try {
                FileUtils.writeStringToFile(tmp, JSON.toJSONString(object), StandardCharsets.UTF_8);
                try {
                    Files.move(tmp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                FileUtils.deleteQuietly(tmp);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String host, String protocol) throws IOException {
        lock.lock();
        try {
            Set<Mapping> mappings = load();
            Mapping removed = null;
            for (Mapping mapping : mappings) {
                if (mapping.matches(host, protocol)) {
                    removed = mapping;
                    break;
                }
            }
            if (removed == null) {
                return false;
            }

            mappings.remove(removed);
            persist(mappings);
            log.info("deleted {}", removed);
            return true;
        } finally {
            lock.unlock();
        }
    }

}
