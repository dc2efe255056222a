package kr.crownrpg.relay.server;

import kr.crownrpg.relay.server.bootstrap.RelayBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * 진입점. 첫 번째 인자는 config.yml이 있는 데이터 디렉터리이며, 생략하면 현재 디렉터리를 쓴다.
 */
public final class RelayServerMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayServerMain.class);

    private RelayServerMain() {
    }

    public static void main(String[] args) {
        Path dataDirectory = Path.of(args.length > 0 ? args[0] : ".");
        RelayBootstrap bootstrap = RelayBootstrap.fromDataDirectory(dataDirectory);
        Runtime.getRuntime().addShutdownHook(new Thread(bootstrap::stop, "relay-shutdown"));
        try {
            bootstrap.start();
        } catch (RuntimeException e) {
            LOGGER.error("Relay server failed to start", e);
            System.exit(1);
        }
    }
}
