package com.chirm.chatapp.dto;

import java.util.List;
import java.util.Map;

public record VoiceRoomsResponse(Map<String, List<String>> rooms) {
}
