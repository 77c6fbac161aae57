package org.chessmate.settings;

import lombok.Data;

@Data
public class MqttSettings {

    private boolean brokerEnabled = false;

    private String host = "0.0.0.0";

    private int port = 1883;

    private boolean persistenceEnabled = false;

    private boolean allowAnonymous = true;

    private String username = "";

    private String password = "";

    private boolean clientEnabled = false;

    private String brokerUrl = "tcp://127.0.0.1:1883";

    private String clientId = "chessmate-host";

    private String commandTopic = "chessmate/command";

    private String replyTopic = "chessmate/reply";

    public MqttSettings copy() {
        MqttSettings copy = new MqttSettings();
        copy.setBrokerEnabled(brokerEnabled);
        copy.setHost(host);
        copy.setPort(port);
        copy.setPersistenceEnabled(persistenceEnabled);
        copy.setAllowAnonymous(allowAnonymous);
        copy.setUsername(username);
        copy.setPassword(password);
        copy.setClientEnabled(clientEnabled);
        copy.setBrokerUrl(brokerUrl);
        copy.setClientId(clientId);
        copy.setCommandTopic(commandTopic);
        copy.setReplyTopic(replyTopic);
        return copy;
    }
}
