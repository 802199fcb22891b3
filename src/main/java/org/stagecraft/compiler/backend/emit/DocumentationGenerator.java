package org.stagecraft.compiler.backend.emit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.frontend.binding.SymbolTable;
import org.stagecraft.compiler.syntax.FieldDeclaration;
import org.stagecraft.compiler.syntax.MethodDeclaration;
import org.stagecraft.compiler.syntax.SourceUnit;
import org.stagecraft.compiler.syntax.TypeDeclaration;
import org.stagecraft.compiler.syntax.Visibility;

/**
 * Generates the documentation output of a module as JSON.
 * <p>
 * Members are identified like {@code T:app.Main}, {@code F:app.Main.count} and
 * {@code M:app.Main.run(int,string)}. The output depends only on the sources and options.
 */
class DocumentationGenerator {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    String generate(ModuleBuildState module) {
        SourceSet sourceSet = module.sourceSet();
        SymbolTable table = sourceSet.boundState().symbolTable();
        boolean includePrivate = module.options().includePrivateMembers();

        JsonArray members = new JsonArray();
        for (SourceUnit unit : sourceSet.units()) {
            for (TypeDeclaration type : unit.types()) {
                String qualified = SymbolTable.qualify(unit.namespace(), type.name());
                if (table.declarationOf(qualified).orElse(null) != type || !visible(type.visibility(), includePrivate)) {
                    continue;
                }
                members.add(member("T:" + qualified, type.documentation()));
                for (FieldDeclaration field : type.fields()) {
                    if (visible(field.visibility(), includePrivate)) {
                        members.add(member("F:" + qualified + "." + field.name(), null));
                    }
                }
                for (MethodDeclaration method : type.methods()) {
                    if (visible(method.visibility(), includePrivate)) {
                        String parameters = method.parameters().isEmpty() ? "" : method.signature();
                        members.add(member("M:" + qualified + "." + method.name() + parameters, method.documentation()));
                    }
                }
            }
        }

        JsonObject root = new JsonObject();
        root.addProperty("assembly", module.moduleName());
        root.add("members", members);
        return GSON.toJson(root);
    }

    private static boolean visible(Visibility visibility, boolean includePrivate) {
        return includePrivate || visibility != Visibility.PRIVATE;
    }

    private static JsonObject member(String id, String summary) {
        JsonObject member = new JsonObject();
        member.addProperty("id", id);
        member.addProperty("summary", summary != null ? summary.trim() : null);
        return member;
    }
}
