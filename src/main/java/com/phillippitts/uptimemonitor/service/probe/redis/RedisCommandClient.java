package com.phillippitts.uptimemonitor.service.probe.redis;

import java.time.Duration;
import java.util.List;

/**
 * Connects to Redis and runs a single command. Production code uses {@link LettuceCommandClient}.
 */
public interface RedisCommandClient {

    /**
     * @param target  connection settings
     * @param command command name followed by its arguments, e.g. {@code [PING]}
     * @param timeout connect and command timeout
     * @return the command's reply rendered as text
     * @throws RuntimeException any connection or command error; the caller reports it as a failed check
     */
    String execute(RedisTarget target, List<String> command, Duration timeout);

    /**
     * Connection settings.
     *
     * @param host     host name
     * @param port     port
     * @param username ACL user, may be null
     * @param password password, may be null
     * @param database database index
     */
    record RedisTarget(String host, int port, String username, String password, int database) {
        @Override
        public String toString() {
            return "RedisTarget[" + host + ":" + port + "/" + database + "]";
        }
    }
}
