package io.mnemo.cli;

@FunctionalInterface
public interface GatewayRunner {
    int run(int port, String hostOverride) throws Exception;
}
