package enterprises.orbital.eveapi.request;

/**
 * Maps library style parameter names (<code>key_id</code>, <code>v_code</code>, <code>character_id</code>) to the
 * names the remote API expects (<code>keyID</code>, <code>vCode</code>, <code>characterID</code>).  Names without
 * underscores are assumed to already be in provider form.
 */
public final class ParameterNames {

  public static final String KEY_ID = "keyID";
  public static final String V_CODE = "vCode";

  private ParameterNames() {}

  public static String toProviderName(String name) {
    if (name.indexOf('_') < 0) return name;
    String[] parts = name.toLowerCase().split("_");
    StringBuilder result = new StringBuilder(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      String next = parts[i];
      if (next.isEmpty()) continue;
      if (next.equals("id"))
        result.append("ID");
      else
        result.append(Character.toUpperCase(next.charAt(0))).append(next.substring(1));
    }
    return result.toString();
  }
}
