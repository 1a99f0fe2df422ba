package wikidb.action;

public class DeleteAction extends OrmAction {
    public DeleteAction(String sql, Object[] params) {
        super(sql, params);
    }

    @Override
    public int getFlushOrder() {
        return 2;
    }
}
