package com.cmdchat.room;

public record CreateRoomResponse(boolean success, RoomView room) {}
