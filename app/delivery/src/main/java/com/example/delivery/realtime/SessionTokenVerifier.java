package com.example.delivery.realtime;

import java.util.Optional;

/** Maps a session token presented on the handshake to the user it was issued for. */
public interface SessionTokenVerifier {

  Optional<String> verify(String token);
}
