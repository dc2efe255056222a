package kr.crownrpg.relay.api.client;

@FunctionalInterface
public interface ClientStateListener {

    void onStateChange(ClientState previous, ClientState current);
}
