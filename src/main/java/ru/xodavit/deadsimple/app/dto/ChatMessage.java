package ru.xodavit.deadsimple.app.dto;

import lombok.Value;

@Value
public class ChatMessage {
  String username;
  String message;
}
