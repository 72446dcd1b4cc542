package com.moodsentinel.core.delivery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Channel whose behavior per message is supplied by the test.
 */
class ScriptedChannel implements DeliveryChannel {

    private final Function<String, DeliveryResult> script;
    private final List<String> messages = Collections.synchronizedList(new ArrayList<>());

    ScriptedChannel(Function<String, DeliveryResult> script) {
        this.script = script;
    }

    static ScriptedChannel acking() {
        return new ScriptedChannel(m -> DeliveryResult.ack());
    }

    @Override
    public String getName() {
        return "scripted";
    }

    @Override
    public DeliveryResult deliver(String message) {
        messages.add(message);
        return script.apply(message);
    }

    List<String> messages() {
        return messages;
    }
}
