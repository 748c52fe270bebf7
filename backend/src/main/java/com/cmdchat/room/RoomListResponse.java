package com.cmdchat.room;

import java.util.List;

public record RoomListResponse(List<RoomView> rooms, int total) {}
