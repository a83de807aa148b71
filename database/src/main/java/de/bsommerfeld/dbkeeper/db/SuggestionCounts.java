package de.bsommerfeld.dbkeeper.db;

public record SuggestionCounts(int pending, int applied) {
}
