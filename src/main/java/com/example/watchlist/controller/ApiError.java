package com.example.watchlist.controller;

public record ApiError(int status,
                       String error,
                       String message,
                       String timestamp) {
}
