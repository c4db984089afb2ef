package com.phillippitts.uptimemonitor.service.probe.redis;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.output.ArrayOutput;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.CommandType;
import io.lettuce.core.resource.ClientResources;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link RedisCommandClient} backed by Lettuce. A client is created and shut down per check so that
 * every check exercises a real connect; all clients share one set of {@link ClientResources} (event
 * loops, timers), which outlives them.
 */
public class LettuceCommandClient implements RedisCommandClient {

    private final ClientResources resources;

    public LettuceCommandClient(ClientResources resources) {
        this.resources = Objects.requireNonNull(resources, "resources");
    }

    ClientResources resources() {
        return resources;
    }

    @Override
    public String execute(RedisTarget target, List<String> command, Duration timeout) {
        RedisURI.Builder uriBuilder = RedisURI.builder()
                .withHost(target.host())
                .withPort(target.port())
                .withDatabase(target.database())
                .withTimeout(timeout);
        if (target.password() != null && !target.password().isEmpty()) {
            if (target.username() != null && !target.username().isEmpty()) {
                uriBuilder.withAuthentication(target.username(), target.password());
            } else {
                uriBuilder.withPassword(target.password().toCharArray());
            }
        }

        RedisClient client = RedisClient.create(resources, uriBuilder.build());
        client.setOptions(ClientOptions.builder()
                .autoReconnect(false)
                .socketOptions(SocketOptions.builder().connectTimeout(timeout).build())
                .build());
        try (StatefulRedisConnection<String, String> connection = client.connect()) {
            RedisCommands<String, String> sync = connection.sync();
            CommandType type = CommandType.valueOf(command.get(0).toUpperCase(Locale.ROOT));
            if (type == CommandType.PING && command.size() == 1) {
                return sync.ping();
            }
            CommandArgs<String, String> args = new CommandArgs<>(StringCodec.UTF8);
            for (String arg : command.subList(1, command.size())) {
                args.add(arg);
            }
            List<Object> reply = sync.dispatch(type, new ArrayOutput<>(StringCodec.UTF8), args);
            return String.valueOf(reply);
        } finally {
            client.shutdown();
        }
    }
}
