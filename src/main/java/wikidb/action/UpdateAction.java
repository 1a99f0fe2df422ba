package wikidb.action;

public class UpdateAction extends OrmAction {
    public UpdateAction(String sql, Object[] params) {
        super(sql, params);
    }

    @Override
    public int getFlushOrder() {
        return 1;
    }
}
