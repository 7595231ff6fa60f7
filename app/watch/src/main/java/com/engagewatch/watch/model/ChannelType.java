package com.engagewatch.watch.model;

public enum ChannelType {
  PUSH,
  EMAIL,
  CHAT_BOT
}
