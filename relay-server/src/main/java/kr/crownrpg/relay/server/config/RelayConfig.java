package kr.crownrpg.relay.server.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code config.yml} 전체. 파일이 없으면 클래스패스의 기본 config.yml을 데이터 디렉터리에 복사한 뒤 읽는다.
 */
public final class RelayConfig {

    public static final String FILE_NAME = "config.yml";

    private final ServerYamlConfig server;
    private final DatabaseYamlConfig database;
    private final EventsYamlConfig events;

    private RelayConfig(ServerYamlConfig server, DatabaseYamlConfig database, EventsYamlConfig events) {
        this.server = server;
        this.database = database;
        this.events = events;
    }

    public static RelayConfig load(Path dataDir, ClassLoader loader) {
        try {
            if (!Files.exists(dataDir)) Files.createDirectories(dataDir);

            Path file = dataDir.resolve(FILE_NAME);
            if (!Files.exists(file)) {
                try (InputStream in = loader.getResourceAsStream(FILE_NAME)) {
                    if (in == null) throw new IllegalStateException("리소스에 기본 config.yml이 존재하지 않습니다.");
                    try (OutputStream out = Files.newOutputStream(file)) {
                        in.transferTo(out);
                    }
                }
            }

            try (InputStream in = Files.newInputStream(file)) {
                return fromYaml(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("config.yml을 불러오지 못했습니다.", e);
        }
    }

    public static RelayConfig fromYaml(InputStream in) {
        Object loaded = new Yaml().load(in);
        Map<String, Object> root = loaded == null ? new LinkedHashMap<>() : ConfigValues.section(loaded);
        return fromMap(root);
    }

    public static RelayConfig fromMap(Map<String, Object> root) {
        return new RelayConfig(
                ServerYamlConfig.fromMap(ConfigValues.section(root.get("server"))),
                DatabaseYamlConfig.fromMap(ConfigValues.section(root.get("database"))),
                EventsYamlConfig.fromMap(ConfigValues.section(root.get("events")))
        );
    }

    public ServerYamlConfig server() { return server; }
    public DatabaseYamlConfig database() { return database; }
    public EventsYamlConfig events() { return events; }
}
