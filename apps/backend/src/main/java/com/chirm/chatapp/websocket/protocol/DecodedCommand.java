package com.chirm.chatapp.websocket.protocol;

public record DecodedCommand(InboundCommandType type, InboundCommand command) {

    public <T extends InboundCommand> T commandAs(Class<T> commandType) {
        return commandType.cast(command);
    }
}
