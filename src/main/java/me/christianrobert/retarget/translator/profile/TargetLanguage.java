package me.christianrobert.retarget.translator.profile;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Catalog of supported target languages.
 *
 * <p>Each entry carries what callers outside the emitters need: the identifier used to
 * request it, the file extension for persisting output, and the line-comment token for
 * generated headers and converted docstrings.</p>
 */
public enum TargetLanguage {
    PYTHON("python", "Python", ".py", "#", "py"),
    JAVASCRIPT("javascript", "JavaScript", ".js", "//", "js", "node"),
    TYPESCRIPT("typescript", "TypeScript", ".ts", "//", "ts"),
    JAVA("java", "Java", ".java", "//"),
    C("c", "C", ".c", "//"),
    CPP("cpp", "C++", ".cpp", "//", "c++", "cxx"),
    CSHARP("csharp", "C#", ".cs", "//", "c#", "cs"),
    GO("go", "Go", ".go", "//", "golang"),
    RUST("rust", "Rust", ".rs", "//", "rs"),
    PHP("php", "PHP", ".php", "//"),
    RUBY("ruby", "Ruby", ".rb", "#", "rb"),
    SWIFT("swift", "Swift", ".swift", "//"),
    KOTLIN("kotlin", "Kotlin", ".kt", "//", "kt"),
    PERL("perl", "Perl", ".pl", "#", "pl"),
    LUA("lua", "Lua", ".lua", "--"),
    DART("dart", "Dart", ".dart", "//"),
    SCALA("scala", "Scala", ".scala", "//"),
    R("r", "R", ".r", "#"),
    POWERSHELL("powershell", "PowerShell", ".ps1", "#", "ps1", "pwsh"),
    JULIA("julia", "Julia", ".jl", "#", "jl");

    private static final Map<String, TargetLanguage> BY_NAME = new HashMap<>();

    static {
        for (TargetLanguage language : values()) {
            BY_NAME.put(language.id, language);
            for (String alias : language.aliases) {
                BY_NAME.put(alias, language);
            }
        }
    }

    private final String id;
    private final String displayName;
    private final String extension;
    private final String commentToken;
    private final List<String> aliases;

    TargetLanguage(String id, String displayName, String extension, String commentToken, String... aliases) {
        this.id = id;
        this.displayName = displayName;
        this.extension = extension;
        this.commentToken = commentToken;
        this.aliases = List.of(aliases);
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getExtension() {
        return extension;
    }

    public String getCommentToken() {
        return commentToken;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /**
     * Case-insensitive lookup by identifier or alias.
     *
     * @return the language, or null when the name is not in the catalog
     */
    public static TargetLanguage fromName(String name) {
        if (name == null) {
            return null;
        }
        return BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
    }
}
