package work.lcod.humantime.cli;

enum OutputFormat {
    JSON,
    TEXT
}
